package com.presence.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing turn-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String USER_ID = "userId";
    public static final String STAGE_ID = "stageId";
    public static final String TURN_ID = "turnId";

    private MdcContext() {}

    public static void setTurn(String userId, String stageId, String turnId) {
        MDC.put(USER_ID, userId);
        if (stageId != null) {
            MDC.put(STAGE_ID, stageId);
        }
        MDC.put(TURN_ID, turnId);
    }

    public static void setUser(String userId) {
        MDC.put(USER_ID, userId);
    }

    public static void clear() {
        MDC.remove(USER_ID);
        MDC.remove(STAGE_ID);
        MDC.remove(TURN_ID);
    }
}
