package com.company.clientpulse.controller;

import com.company.clientpulse.domain.QueueStats;
import com.company.clientpulse.service.EvaluationQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/queue")
@Tag(name = "Queue", description = "Evaluation queue statistics")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearer-jwt")
public class QueueController {

    private final EvaluationQueue evaluationQueue;

    @GetMapping("/stats")
    @Operation(summary = "Point-in-time queue counters")
    @PreAuthorize("hasAnyRole('PULSE_READER', 'PULSE_OPERATOR')")
    public ResponseEntity<QueueStats> stats() {
        return ResponseEntity.ok(evaluationQueue.stats());
    }
}
