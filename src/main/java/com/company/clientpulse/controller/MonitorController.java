package com.company.clientpulse.controller;

import com.company.clientpulse.domain.MonitoredTarget;
import com.company.clientpulse.dto.request.RegisterMonitorRequest;
import com.company.clientpulse.dto.response.MonitorResponse;
import com.company.clientpulse.service.EvaluationQueue;
import com.company.clientpulse.service.MonitorService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/monitors")
@Tag(name = "Monitors", description = "Register and remove monitored network/client pairs")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class MonitorController {

    private final MonitorService monitorService;
    private final EvaluationQueue evaluationQueue;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "List monitors", description = "Optionally restricted to one network")
    @PreAuthorize("hasAnyRole('PULSE_READER', 'PULSE_OPERATOR')")
    public ResponseEntity<List<MonitorResponse>> list(@RequestParam(required = false) String network) {
        List<MonitorResponse> monitors = monitorService.list(network).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(monitors);
    }

    @GetMapping("/{network}/{client}")
    @Operation(summary = "Get a monitor")
    @PreAuthorize("hasAnyRole('PULSE_READER', 'PULSE_OPERATOR')")
    public ResponseEntity<MonitorResponse> get(@PathVariable String network, @PathVariable String client) {
        return ResponseEntity.ok(toResponse(monitorService.get(network, client)));
    }

    @PostMapping
    @Operation(summary = "Register a monitor", description = "Replaces an existing monitor for the same network and client")
    @PreAuthorize("hasRole('PULSE_OPERATOR')")
    public ResponseEntity<MonitorResponse> register(@Valid @RequestBody RegisterMonitorRequest request) {
        MonitoredTarget target = monitorService.register(
                request.getNetwork(), request.getClient(), request.getChannel(), request.getSchedule());

        meterRegistry.counter("api.monitors.registered", "client", target.getClient()).increment();

        return ResponseEntity
                .created(URI.create("/api/v1/monitors/" + target.getNetwork() + "/" + target.getClient()))
                .body(toResponse(target));
    }

    @DeleteMapping("/{network}/{client}")
    @Operation(summary = "Deregister a monitor")
    @PreAuthorize("hasRole('PULSE_OPERATOR')")
    public ResponseEntity<Void> deregister(@PathVariable String network, @PathVariable String client) {
        monitorService.deregister(network, client);
        log.info("Deregistered monitor for {} on {}", client, network);
        return ResponseEntity.noContent().build();
    }

    private MonitorResponse toResponse(MonitoredTarget target) {
        return MonitorResponse.from(target, evaluationQueue.stateOf(target.targetKey()).name());
    }
}
