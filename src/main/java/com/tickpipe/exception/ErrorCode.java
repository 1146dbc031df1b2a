package com.tickpipe.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure categories raised by the pipeline. {@code recoverable} tells the owning component
 * whether it may retry locally or must escalate.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    AUTH_REJECTED("AUTH_REJECTED", false),
    CAPACITY_EXCEEDED("CAPACITY_EXCEEDED", false),
    TRANSPORT_ERROR("TRANSPORT_ERROR", true),
    DECODE_ERROR("DECODE_ERROR", false),
    COMMIT_FAILURE("COMMIT_FAILURE", true),
    BROKER_ERROR("BROKER_ERROR", true);

    private final String code;
    private final boolean recoverable;
}
