package com.riskgate.exception;

import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Single home for the "log and continue" sites of the risk gate.
 *
 * <p>The gate may under-protect only where a lookup is explicitly optional (drawdown signal,
 * incident persistence, lease payloads, stale lease cleanup, event publication). Each of those
 * sites calls one of these methods with the logger of the owning class, an operation name that
 * becomes the log event, and the level the failure deserves, so every swallowed exception is
 * logged the same way and can be found by grepping for {@code BestEffort}.
 */
public final class BestEffort {

    private BestEffort() {}

    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    /**
     * Runs {@code action} and returns its result, or {@code fallback} if it throws.
     */
    public static <T> T getOrDefault(Logger log, Level level, String operation, Callable<T> action, T fallback) {
        try {
            return action.call();
        } catch (Exception e) {
            log.atLevel(level).setCause(e).log("{} error={}", operation, String.valueOf(e.getMessage()));
            return fallback;
        }
    }

    /**
     * Runs {@code action}; returns false (after logging) if it throws.
     */
    public static boolean run(Logger log, Level level, String operation, Action action) {
        try {
            action.run();
            return true;
        } catch (Exception e) {
            log.atLevel(level).setCause(e).log("{} error={}", operation, String.valueOf(e.getMessage()));
            return false;
        }
    }
}
