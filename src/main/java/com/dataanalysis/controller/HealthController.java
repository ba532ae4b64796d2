package com.dataanalysis.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    @GetMapping({"", "/"})
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of("message", "Data Analysis API v2.0", "status", "healthy"));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "healthy",
            "services", Map.of("forecast_engine", "ready")));
    }
}
