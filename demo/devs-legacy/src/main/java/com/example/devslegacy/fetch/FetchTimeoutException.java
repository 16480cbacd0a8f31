package com.example.devslegacy.fetch;

import java.time.Duration;

public class FetchTimeoutException extends FetchException {

    private final Duration timeout;

    public FetchTimeoutException(String url, Duration timeout, Throwable cause) {
        super(url, "network timeout at: " + url, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public Kind kind() {
        return Kind.TIMEOUT;
    }

    @Override
    public String getDetail() {
        return getClass().getSimpleName() + ": " + getMessage();
    }
}
