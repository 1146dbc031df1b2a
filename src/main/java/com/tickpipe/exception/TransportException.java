package com.tickpipe.exception;

/** Socket or queue connection failure. Recoverable with backoff. */
public class TransportException extends BaseException {

    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }
}
