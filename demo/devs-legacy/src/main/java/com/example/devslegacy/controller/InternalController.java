package com.example.devslegacy.controller;

import com.example.devslegacy.internal.PrivilegedResource;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.lang.management.ManagementFactory;

/**
 * Internal debug service. No credential is checked here: it is reachable only through the
 * loopback connector, see {@link com.example.devslegacy.filter.ConnectorIsolationFilter}.
 */
@RestController
@RequestMapping("/internal")
public class InternalController {

    public record InternalInfo(String name, double uptime) {
    }

    private final PrivilegedResource privilegedResource;

    public InternalController(PrivilegedResource privilegedResource) {
        this.privilegedResource = privilegedResource;
    }

    @GetMapping(value = "/flag", produces = MediaType.TEXT_PLAIN_VALUE)
    public String flag() {
        return "admin-secret: " + privilegedResource.secret() + "\n";
    }

    @GetMapping("/info")
    public InternalInfo info() {
        double uptime = ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
        return new InternalInfo("internal-debug", uptime);
    }
}
