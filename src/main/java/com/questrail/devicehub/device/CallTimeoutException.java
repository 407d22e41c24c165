package com.questrail.devicehub.device;

import java.time.Duration;

/**
 * No reply arrived within the call's timeout. Not fatal to the device actor.
 */
public final class CallTimeoutException extends RuntimeException
{
    public CallTimeoutException(String what, Duration timeout) {
        super(what + " timed out after " + timeout.toMillis() + "ms");
    }
}
