package com.example.devslegacy.controller;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ApiInfoController {

    public record ApiInfo(String name, List<String> endpoints, String note) {
    }

    private static final ApiInfo INFO = new ApiInfo(
            "DEVS legacy (SSRF demo)",
            List.of("/api/fetch?url=...", "/api/info", "/api/health"),
            "Public fetch tool blocks obvious local hostnames but not all IP encodings.");

    @GetMapping("/info")
    public ApiInfo info() {
        return INFO;
    }

    @GetMapping(value = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
    public String health() {
        return "ok";
    }
}
