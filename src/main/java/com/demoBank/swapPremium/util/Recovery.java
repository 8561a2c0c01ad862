package com.demoBank.swapPremium.util;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * Composes an operation with an explicit error-recovery policy.
 *
 * Used where pipelines are assembled so that per-record failures become typed
 * {@link Outcome}s instead of aborting the batch.
 */
@Slf4j
public class Recovery {

    /**
     * What to do with a runtime failure of the wrapped operation.
     */
    public enum Policy {
        /**
         * Log the failure and return it as {@link Outcome#failure}.
         */
        DROP,
        /**
         * Rethrow the failure to the caller.
         */
        PROPAGATE
    }

    private Recovery() {}

    /**
     * Wraps {@code operation} so that it returns an {@link Outcome}.
     *
     * @param operation the operation to protect
     * @param policy how failures are handled
     * @param operationName name used in log messages
     */
    public static <I, O> Function<I, Outcome<O>> withRecovery(Function<I, O> operation,
                                                             Policy policy,
                                                             String operationName) {
        return input -> {
            try {
                return Outcome.success(operation.apply(input));
            } catch (RuntimeException e) {
                if (policy == Policy.PROPAGATE) {
                    throw e;
                }
                log.warn("Recovered failure in {} - dropping input: {}", operationName, e.getMessage());
                log.debug("Failure detail for {}", operationName, e);
                return Outcome.failure(e);
            }
        };
    }
}
