package com.fourpaws.backend.global.error;

/**
 * A problem the caller may retry after re-reading state: a stale {@code expectedVersion}, or a
 * lock conflict reported by the store.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(ErrorCode errorCode, String detail, int retryAfterSeconds) {
        super(errorCode, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RetryableProblemException concurrentModification(String entityType) {
        return new RetryableProblemException(
                ErrorCode.CONCURRENT_MODIFICATION,
                entityType + " was modified by another request",
                0
        );
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
