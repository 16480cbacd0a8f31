package com.example.devslegacy.controller;

import com.example.devslegacy.fetch.FetchException;
import com.example.devslegacy.fetch.FetchResult;
import com.example.devslegacy.fetch.FetchService;
import com.example.devslegacy.validation.UrlValidationPolicy;
import com.example.devslegacy.validation.ValidationDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class FetchController {

    private static final Logger log = LoggerFactory.getLogger(FetchController.class);

    public record FetchResponse(int status, String url, String body) {
        static FetchResponse from(FetchResult r) {
            return new FetchResponse(r.statusCode(), r.url(), r.body());
        }
    }

    private final UrlValidationPolicy validationPolicy;
    private final FetchService fetchService;

    public FetchController(UrlValidationPolicy validationPolicy, FetchService fetchService) {
        this.validationPolicy = validationPolicy;
        this.fetchService = fetchService;
    }

    // CWE-918: SSRF (intentionally weak: substring forbidlist only)
    @GetMapping("/fetch")
    public ResponseEntity<?> fetch(@RequestParam(value = "url", required = false) String url) {
        String candidate = url == null ? "" : trimUrl(url);
        if (candidate.isEmpty()) {
            return error(HttpStatus.BAD_REQUEST, "url parameter required");
        }

        ValidationDecision decision = validationPolicy.validate(candidate);
        switch (decision.outcome()) {
            case FORBIDDEN:
                return error(HttpStatus.FORBIDDEN, decision.reason());
            case UNSUPPORTED_SCHEME:
                return error(HttpStatus.BAD_REQUEST, decision.reason());
            default:
                break;
        }

        try {
            FetchResult result = fetchService.fetch(candidate); // <-- sink
            return ResponseEntity.ok(FetchResponse.from(result));
        } catch (FetchException e) {
            log.warn("fetch of {} failed ({}): {}", candidate, e.kind(), e.getDetail());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("fetch failed", e.getDetail()));
        }
    }

    /** Trims the same characters as ECMAScript {@code String.prototype.trim}. */
    static String trimUrl(String url) {
        int start = 0;
        int end = url.length();
        while (start < end && isTrimmable(url.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(url.charAt(end - 1))) {
            end--;
        }
        return url.substring(start, end);
    }

    private static boolean isTrimmable(char c) {
        switch (c) {
            case '\t':
            case '\n':
            case '\u000B':
            case '\f':
            case '\r':
            case '\uFEFF':
                return true;
            default:
                int type = Character.getType(c);
                return type == Character.SPACE_SEPARATOR
                        || type == Character.LINE_SEPARATOR
                        || type == Character.PARAGRAPH_SEPARATOR;
        }
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(message, null));
    }
}
