package com.tickpipe.exception;

/** Kite REST call failed (instrument dump, LTP lookup). Retried by the kiteApi policy. */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }
}
