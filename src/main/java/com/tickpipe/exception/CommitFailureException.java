package com.tickpipe.exception;

/** Durable write of a flush batch failed; pending ticks stay buffered for the next cycle. */
public class CommitFailureException extends BaseException {

    public CommitFailureException(String message, Throwable cause) {
        super(ErrorCode.COMMIT_FAILURE, message, cause);
    }
}
