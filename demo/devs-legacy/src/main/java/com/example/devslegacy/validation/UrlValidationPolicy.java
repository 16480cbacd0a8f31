package com.example.devslegacy.validation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Naive forbidlist for the public fetch tool.
 * <p>
 * Only the literal strings below are rejected. The host is never resolved or normalised, so
 * decimal, octal and hex spellings of 127.0.0.1, {@code [::1]} and private ranges all pass.
 * That gap is what the demo exists to show; keep it.
 */
@Component
public class UrlValidationPolicy {

    static final List<String> FORBIDDEN_SUBSTRINGS = List.of("localhost", "127.0.0.1", "::1");

    public static final String LOCAL_ADDRESS_REASON = "local addresses are not allowed";
    public static final String SCHEME_REASON = "only http and https allowed";

    private static final Pattern HTTP_SCHEME = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);

    public ValidationDecision validate(String url) {
        String lowered = url.toLowerCase(Locale.ROOT);
        for (String forbidden : FORBIDDEN_SUBSTRINGS) {
            if (lowered.contains(forbidden)) {
                return ValidationDecision.forbidden(LOCAL_ADDRESS_REASON);
            }
        }
        if (!HTTP_SCHEME.matcher(url).find()) {
            return ValidationDecision.unsupportedScheme(SCHEME_REASON);
        }
        return ValidationDecision.allow();
    }
}
