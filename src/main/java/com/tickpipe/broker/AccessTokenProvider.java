package com.tickpipe.broker;

/**
 * Source of the broker session token shared by all socket sessions.
 */
public interface AccessTokenProvider {

    /** The current token, acquiring one first if none is held. */
    String currentToken();

    /**
     * Replaces a token the broker rejected. Concurrent callers reporting the same rejected token
     * share one refresh; a caller whose token was already replaced gets the newer token back.
     *
     * @throws com.tickpipe.exception.AuthRejectedException when no fresh token can be obtained
     */
    String refresh(String rejectedToken);
}
