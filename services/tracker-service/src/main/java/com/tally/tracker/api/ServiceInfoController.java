package com.tally.tracker.api;

import com.tally.tracker.config.TrackerServiceProperties;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Service description and endpoint directory, served at the root and under {@code /api/v1}. */
@RestController
public class ServiceInfoController {

    private final TrackerServiceProperties properties;

    public ServiceInfoController(TrackerServiceProperties properties) {
        this.properties = properties;
    }

    @GetMapping({"/", "/api/v1/info"})
    public Map<String, Object> serviceInfo() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("POST /api/v1/buy", "Log a product purchase");
        endpoints.put("POST /api/v1/visit", "Log a page visit");
        endpoints.put("GET /api/v1/stats", "Running total and recent event count");
        endpoints.put("GET /api/v1/health", "Liveness check");

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description() != null ? properties.description() : "");
        info.put("status", "running");
        info.put("timestamp", Instant.now().toString());
        info.put("endpoints", endpoints);
        return info;
    }
}
