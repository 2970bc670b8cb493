package com.automaker.dispatch.api;

import com.automaker.core.model.FeatureImage;

import java.util.List;

/**
 * Body for POST /api/v1/auto-mode/follow-up-feature.
 */
public record FollowUpRequest(
    String projectPath,
    String featureId,
    String prompt,
    List<FeatureImage> imagePaths,
    Boolean useWorktrees
) {}
