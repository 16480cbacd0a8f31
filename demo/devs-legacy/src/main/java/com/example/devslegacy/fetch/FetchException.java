package com.example.devslegacy.fetch;

public abstract class FetchException extends Exception {

    public enum Kind {
        TIMEOUT,
        NETWORK
    }

    private final String url;

    protected FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    public abstract Kind kind();

    /** Human readable cause, returned to the caller as {@code detail}. */
    public abstract String getDetail();
}
