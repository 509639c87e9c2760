package com.taskwave.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing planner MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlan(String planId, String strategy) {
        MDC.put("planId", planId);
        MDC.put("strategy", strategy);
    }

    public static void clear() {
        MDC.remove("planId");
        MDC.remove("strategy");
    }
}
