package com.automaker.core.model;

import java.util.List;

/**
 * Copy-with builder for features in tests. Production code only changes features through the
 * context store.
 */
public final class FeatureFixtures {

    private Feature f;

    private FeatureFixtures(Feature feature) {
        this.f = feature;
    }

    public static FeatureFixtures from(Feature feature) {
        return new FeatureFixtures(feature);
    }

    public FeatureFixtures withStatus(FeatureStatus status) {
        f = new Feature(f.id(), f.category(), f.description(), f.steps(), status, f.priority(), f.provider(),
                f.model(), f.thinkingLevel(), f.skipTests(), f.imagePaths(), f.spec(), f.worktreePath(),
                f.branchName(), f.baseBranch(), f.startedAt(), f.updatedAt(), f.justFinishedAt(), f.summary(),
                f.error());
        return this;
    }

    public FeatureFixtures withPriority(Integer priority) {
        f = new Feature(f.id(), f.category(), f.description(), f.steps(), f.status(), priority, f.provider(),
                f.model(), f.thinkingLevel(), f.skipTests(), f.imagePaths(), f.spec(), f.worktreePath(),
                f.branchName(), f.baseBranch(), f.startedAt(), f.updatedAt(), f.justFinishedAt(), f.summary(),
                f.error());
        return this;
    }

    public FeatureFixtures withModel(String provider, String model, ThinkingLevel thinkingLevel) {
        f = new Feature(f.id(), f.category(), f.description(), f.steps(), f.status(), f.priority(), provider,
                model, thinkingLevel, f.skipTests(), f.imagePaths(), f.spec(), f.worktreePath(),
                f.branchName(), f.baseBranch(), f.startedAt(), f.updatedAt(), f.justFinishedAt(), f.summary(),
                f.error());
        return this;
    }

    public FeatureFixtures withSkipTests(boolean skipTests) {
        f = new Feature(f.id(), f.category(), f.description(), f.steps(), f.status(), f.priority(), f.provider(),
                f.model(), f.thinkingLevel(), skipTests, f.imagePaths(), f.spec(), f.worktreePath(),
                f.branchName(), f.baseBranch(), f.startedAt(), f.updatedAt(), f.justFinishedAt(), f.summary(),
                f.error());
        return this;
    }

    public FeatureFixtures withSpec(String spec, List<FeatureImage> images) {
        f = new Feature(f.id(), f.category(), f.description(), f.steps(), f.status(), f.priority(), f.provider(),
                f.model(), f.thinkingLevel(), f.skipTests(), images, spec, f.worktreePath(),
                f.branchName(), f.baseBranch(), f.startedAt(), f.updatedAt(), f.justFinishedAt(), f.summary(),
                f.error());
        return this;
    }

    public Feature build() {
        return f;
    }
}
