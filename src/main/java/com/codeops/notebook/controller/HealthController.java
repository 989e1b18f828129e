package com.codeops.notebook.controller;

import com.codeops.notebook.config.AppConstants;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Unauthenticated liveness endpoint.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX)
@Tag(name = "Health", description = "Service health check")
public class HealthController {

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "UP",
                "service", AppConstants.SERVICE_NAME,
                "timestamp", Instant.now().toString()
        );
    }
}
