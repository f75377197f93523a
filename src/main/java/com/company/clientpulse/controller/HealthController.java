package com.company.clientpulse.controller;

import com.company.clientpulse.service.EvaluationQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final EvaluationQueue evaluationQueue;

    @GetMapping
    @Operation(summary = "Health check", description = "DOWN once the evaluation queue has stopped")
    public ResponseEntity<Map<String, Object>> health() {
        boolean up = evaluationQueue.isRunning();

        Map<String, Object> response = new HashMap<>();
        response.put("status", up ? "UP" : "DOWN");
        response.put("timestamp", Instant.now());
        response.put("service", "client-pulse-service");
        response.put("version", "1.0.0");

        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}
