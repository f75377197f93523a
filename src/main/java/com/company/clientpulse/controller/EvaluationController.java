package com.company.clientpulse.controller;

import com.company.clientpulse.config.ClientCatalog;
import com.company.clientpulse.domain.EnqueueResult;
import com.company.clientpulse.domain.EvaluationRequest;
import com.company.clientpulse.domain.MonitoredTarget;
import com.company.clientpulse.domain.enums.ClientType;
import com.company.clientpulse.dto.request.EvaluationTriggerRequest;
import com.company.clientpulse.dto.response.EnqueueResponse;
import com.company.clientpulse.exception.UnknownClientException;
import com.company.clientpulse.repository.MonitorRepository;
import com.company.clientpulse.service.EvaluationQueue;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/evaluations")
@Tag(name = "Evaluations", description = "Manually trigger client evaluations")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class EvaluationController {

    private final EvaluationQueue evaluationQueue;
    private final MonitorRepository monitorRepository;
    private final ClientCatalog clientCatalog;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Queue an evaluation",
            description = "202 when queued, 409 when the target is already queued or running, 503 when the queue is full or stopped")
    @PreAuthorize("hasRole('PULSE_OPERATOR')")
    public ResponseEntity<EnqueueResponse> trigger(@Valid @RequestBody EvaluationTriggerRequest request) {
        Optional<MonitoredTarget> monitor = monitorRepository.get(request.getNetwork(), request.getClient());

        ClientType clientType = monitor.map(MonitoredTarget::getClientType)
                .or(() -> clientCatalog.typeOf(request.getClient()))
                .orElseThrow(() -> new UnknownClientException(request.getClient()));

        String channel = request.getChannel() != null
                ? request.getChannel()
                : monitor.map(MonitoredTarget::getChannel).orElse(null);

        EnqueueResult result = evaluationQueue.enqueue(EvaluationRequest.builder()
                .network(request.getNetwork())
                .client(request.getClient())
                .clientType(clientType)
                .channel(channel)
                .build());

        meterRegistry.counter("api.evaluations.requests",
                "status", result.getStatus().name().toLowerCase()
        ).increment();

        log.info("Manual evaluation of {} on {}: {}", request.getClient(), request.getNetwork(), result.getStatus());

        return ResponseEntity.status(statusFor(result)).body(EnqueueResponse.builder()
                .targetKey(result.getTargetKey())
                .status(result.getStatus().name())
                .message(result.getStatus().getDescription())
                .build());
    }

    @GetMapping("/{network}/{client}")
    @Operation(summary = "Current queue state of a target")
    @PreAuthorize("hasAnyRole('PULSE_READER', 'PULSE_OPERATOR')")
    public ResponseEntity<Map<String, String>> state(@PathVariable String network, @PathVariable String client) {
        String key = EvaluationRequest.targetKey(network, client);
        return ResponseEntity.ok(Map.of(
                "targetKey", key,
                "state", evaluationQueue.stateOf(key).name()));
    }

    private static HttpStatus statusFor(EnqueueResult result) {
        switch (result.getStatus()) {
            case ACCEPTED:
                return HttpStatus.ACCEPTED;
            case ALREADY_RUNNING:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }
}
