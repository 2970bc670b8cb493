package com.automaker.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Automaker-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectPath) {
        MDC.put("projectPath", projectPath);
    }

    public static void setFeature(String projectPath, String featureId) {
        MDC.put("projectPath", projectPath);
        MDC.put("featureId", featureId);
    }

    public static void setModel(String model) {
        MDC.put("model", model);
    }

    public static void clear() {
        MDC.remove("projectPath");
        MDC.remove("featureId");
        MDC.remove("model");
    }
}
