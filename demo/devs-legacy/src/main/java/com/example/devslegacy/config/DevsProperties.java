package com.example.devslegacy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "devs")
public record DevsProperties(String flag, @DefaultValue Fetch fetch) {

    public static final String DEFAULT_FLAG = "FLAG{ssrf_decimal_wrap}";

    public DevsProperties {
        // an empty FLAG counts as unset
        if (flag == null || flag.isEmpty()) {
            flag = DEFAULT_FLAG;
        }
    }

    public record Fetch(
            @DefaultValue("5000ms") Duration timeout,
            @DefaultValue("2000") int maxBodyChars,
            @DefaultValue("\n\n...[truncated]") String truncationMarker) {
    }
}
