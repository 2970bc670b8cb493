package com.automaker.dispatch.api;

/**
 * Body for POST /api/v1/auto-mode/start.
 *
 * @param maxConcurrency nullable; defaults to {@code automaker.auto-mode.max-concurrency}
 */
public record StartRequest(String projectPath, Integer maxConcurrency) {}
