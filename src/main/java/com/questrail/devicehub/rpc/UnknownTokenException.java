package com.questrail.devicehub.rpc;

/**
 * A reply referenced a correlation token with no caller recorded under it:
 * the call already completed, timed out, or the token was never issued.
 */
public final class UnknownTokenException extends RuntimeException
{
    private final int token;

    public UnknownTokenException(int token) {
        super("no caller waiting on token " + token);
        this.token = token;
    }

    public int token() {
        return token;
    }
}
