package com.automaker.core.state;

import com.automaker.core.model.Feature;
import com.automaker.core.model.FeatureStatus;
import com.automaker.core.model.InvalidTransitionException;
import com.automaker.core.model.RunResult;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.automaker.core.model.FeatureStatus.BACKLOG;
import static com.automaker.core.model.FeatureStatus.IN_PROGRESS;
import static com.automaker.core.model.FeatureStatus.VERIFIED;
import static com.automaker.core.model.FeatureStatus.WAITING_APPROVAL;

/**
 * Allowed feature status transitions and the policy mapping a run outcome to the next status.
 * <p>
 * Stateless: callers pass the feature as last read from storage.
 */
public final class FeatureStateMachine {

    private static final Map<FeatureStatus, Set<FeatureStatus>> ALLOWED = new EnumMap<>(FeatureStatus.class);

    static {
        ALLOWED.put(BACKLOG, EnumSet.of(BACKLOG, IN_PROGRESS));
        // in_progress -> in_progress covers resuming after a restart
        ALLOWED.put(IN_PROGRESS, EnumSet.of(IN_PROGRESS, VERIFIED, WAITING_APPROVAL, BACKLOG));
        ALLOWED.put(WAITING_APPROVAL, EnumSet.of(WAITING_APPROVAL, IN_PROGRESS, VERIFIED, BACKLOG));
        ALLOWED.put(VERIFIED, EnumSet.of(VERIFIED, IN_PROGRESS, BACKLOG));
    }

    private static final Set<FeatureStatus> MERGEABLE = EnumSet.of(WAITING_APPROVAL, VERIFIED);

    private FeatureStateMachine() {}

    public static boolean isAllowed(FeatureStatus from, FeatureStatus to) {
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * Throws {@link InvalidTransitionException} unless {@code from -> to} is allowed.
     */
    public static void requireTransition(String featureId, FeatureStatus from, FeatureStatus to) {
        if (!isAllowed(from, to)) {
            throw new InvalidTransitionException(featureId, from, to);
        }
    }

    /** Merge is only offered for features a human can review. */
    public static void requireMergeable(Feature feature) {
        if (!MERGEABLE.contains(feature.status())) {
            throw new InvalidTransitionException(feature.id(), feature.status(), VERIFIED);
        }
    }

    /**
     * Whether a run left the feature passing, judged from the status re-read after the run.
     * The agent reports success by moving the feature to verified, or to waiting_approval
     * when tests are skipped.
     */
    public static boolean passes(Feature reread) {
        if (reread == null) {
            return false;
        }
        return reread.status() == VERIFIED
                || (reread.skipTests() && reread.status() == WAITING_APPROVAL);
    }

    /**
     * Status to write after a run finishes.
     *
     * @return empty when the run was stopped by the user; the status is then left as-is
     */
    public static Optional<FeatureStatus> statusAfterRun(Feature feature, RunResult result) {
        if (result.stopped()) {
            return Optional.empty();
        }
        if (result.passes()) {
            return Optional.of(feature.skipTests() ? WAITING_APPROVAL : VERIFIED);
        }
        return Optional.of(WAITING_APPROVAL);
    }

    /** Status after a run aborted with an error: always human review. */
    public static FeatureStatus statusAfterError() {
        return WAITING_APPROVAL;
    }

    /**
     * Status an agent may set through the status-update tool. Skip-tests features are never
     * auto-verified, so a requested verified becomes waiting_approval.
     */
    public static FeatureStatus reportedStatus(Feature feature, FeatureStatus requested) {
        if (requested == VERIFIED && feature.skipTests()) {
            return WAITING_APPROVAL;
        }
        return requested;
    }

    /** Status after a verification command sequence. */
    public static FeatureStatus statusAfterVerification(boolean allPassed) {
        return allPassed ? VERIFIED : WAITING_APPROVAL;
    }
}
