package com.example.devslegacy.internal;

import java.util.Objects;

/**
 * The admin secret served by the loopback-only debug service.
 * Created once at startup from {@code FLAG} and never changed afterwards.
 */
public final class PrivilegedResource {

    private final String secret;

    public PrivilegedResource(String secret) {
        this.secret = Objects.requireNonNull(secret, "secret");
    }

    public String secret() {
        return secret;
    }

    @Override
    public String toString() {
        return "PrivilegedResource[****]";
    }
}
