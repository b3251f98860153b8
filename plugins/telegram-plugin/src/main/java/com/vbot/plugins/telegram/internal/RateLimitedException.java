package com.vbot.plugins.telegram.internal;

import com.vbot.api.TransportException;

public class RateLimitedException extends TransportException {
    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds, String message) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
