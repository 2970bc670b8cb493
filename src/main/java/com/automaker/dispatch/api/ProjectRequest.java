package com.automaker.dispatch.api;

public record ProjectRequest(String projectPath) {}
