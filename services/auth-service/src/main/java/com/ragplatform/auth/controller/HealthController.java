package com.ragplatform.auth.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe used by the platform's startup scripts.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "auth-svc";

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", SERVICE_NAME);
        return ResponseEntity.ok(body);
    }
}
