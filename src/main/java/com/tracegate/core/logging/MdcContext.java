package com.tracegate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tracegate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId) {
        MDC.put("planId", planId);
    }

    public static void setArtifact(String artifactId) {
        MDC.put("artifactId", artifactId);
    }

    public static void setSuite(String suiteId, String artifactId) {
        MDC.put("suiteId", suiteId);
        MDC.put("artifactId", artifactId);
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("artifactId");
        MDC.remove("suiteId");
    }
}
