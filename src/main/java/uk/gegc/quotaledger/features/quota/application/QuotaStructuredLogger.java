package uk.gegc.quotaledger.features.quota.application;

import org.slf4j.Logger;
import org.slf4j.MDC;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;

/**
 * Puts the quota fields into the MDC for the duration of a single log call so the
 * {@code logback-spring.xml} pattern can render them.
 */
public final class QuotaStructuredLogger {

    private static final String USERNAME = "quota.username";
    private static final String TX_TYPE = "quota.txType";
    private static final String AMOUNT = "quota.amount";
    private static final String BALANCE_BEFORE = "quota.balanceBefore";
    private static final String BALANCE_AFTER = "quota.balanceAfter";
    private static final String SESSION_ID = "quota.sessionId";
    private static final String RESOURCE_TYPE = "quota.resourceType";
    private static final String RULE = "quota.rule";

    private QuotaStructuredLogger() {
    }

    public static void logLedgerWrite(Logger logger, String level, String message,
                                      String username, QuotaTransactionType txType, long amount,
                                      long balanceBefore, long balanceAfter, Long sessionId,
                                      Object... args) {
        MDC.put(USERNAME, username);
        MDC.put(TX_TYPE, txType != null ? txType.name() : null);
        MDC.put(AMOUNT, String.valueOf(amount));
        MDC.put(BALANCE_BEFORE, String.valueOf(balanceBefore));
        MDC.put(BALANCE_AFTER, String.valueOf(balanceAfter));
        MDC.put(SESSION_ID, sessionId != null ? sessionId.toString() : null);
        try {
            log(logger, level, message, args);
        } finally {
            clear();
        }
    }

    public static void logSessionEvent(Logger logger, String level, String message,
                                       String username, Long sessionId, String resourceType,
                                       Object... args) {
        MDC.put(USERNAME, username);
        MDC.put(SESSION_ID, sessionId != null ? sessionId.toString() : null);
        MDC.put(RESOURCE_TYPE, resourceType);
        try {
            log(logger, level, message, args);
        } finally {
            clear();
        }
    }

    public static void logRefresh(Logger logger, String level, String message,
                                  String ruleName, Object... args) {
        MDC.put(RULE, ruleName);
        try {
            log(logger, level, message, args);
        } finally {
            clear();
        }
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }

    private static void clear() {
        MDC.remove(USERNAME);
        MDC.remove(TX_TYPE);
        MDC.remove(AMOUNT);
        MDC.remove(BALANCE_BEFORE);
        MDC.remove(BALANCE_AFTER);
        MDC.remove(SESSION_ID);
        MDC.remove(RESOURCE_TYPE);
        MDC.remove(RULE);
    }
}
