package com.example.devslegacy.fetch;

public record FetchResult(int statusCode, String url, String body, boolean truncated) {

    /**
     * Keeps at most {@code maxChars} characters of {@code rawBody} and appends {@code marker}
     * when anything was cut.
     */
    public static FetchResult of(int statusCode, String url, String rawBody, int maxChars, String marker) {
        String text = rawBody == null ? "" : rawBody;
        if (text.length() > maxChars) {
            return new FetchResult(statusCode, url, text.substring(0, maxChars) + marker, true);
        }
        return new FetchResult(statusCode, url, text, false);
    }
}
