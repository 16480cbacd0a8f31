package com.example.devslegacy.fetch;

public class FetchNetworkException extends FetchException {

    public FetchNetworkException(String url, Throwable cause) {
        super(url, "request to " + url + " failed", cause);
    }

    @Override
    public Kind kind() {
        return Kind.NETWORK;
    }

    @Override
    public String getDetail() {
        Throwable cause = getCause();
        if (cause == null) {
            return getMessage();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
