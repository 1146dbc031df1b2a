package com.tickpipe.exception;

/**
 * The broker refused the session token, or a fresh token could not be obtained.
 * Socket sessions never retry this locally; the session manager owns the refresh.
 */
public class AuthRejectedException extends BaseException {

    public AuthRejectedException(String message) {
        super(ErrorCode.AUTH_REJECTED, message);
    }

    public AuthRejectedException(String message, Throwable cause) {
        super(ErrorCode.AUTH_REJECTED, message, cause);
    }
}
