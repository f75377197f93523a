package com.company.clientpulse.controller;

import com.company.clientpulse.domain.CheckArtifact;
import com.company.clientpulse.exception.CheckNotFoundException;
import com.company.clientpulse.repository.CheckArtifactRepository;
import com.company.clientpulse.util.CheckIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/checks")
@Tag(name = "Checks", description = "Stored check runs for debugging alerts")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class CheckController {

    private final CheckArtifactRepository checkArtifactRepository;

    @GetMapping("/{checkId}")
    @Operation(summary = "Get a check run",
            description = "Results, analysis and log of the run; pass the network to skip the cross-network lookup")
    @PreAuthorize("hasAnyRole('PULSE_READER', 'PULSE_OPERATOR')")
    public ResponseEntity<CheckArtifact> get(@PathVariable String checkId,
                                             @RequestParam(required = false) String network) {
        if (!CheckIds.isValid(checkId)) {
            throw new IllegalArgumentException("Malformed check id: " + checkId);
        }

        CheckArtifact artifact = (network == null || network.isBlank()
                ? checkArtifactRepository.find(checkId)
                : checkArtifactRepository.get(network, checkId))
                .orElseThrow(() -> new CheckNotFoundException(checkId));

        log.debug("Served check {} for {} on {}", checkId, artifact.getClient(), artifact.getNetwork());
        return ResponseEntity.ok(artifact);
    }
}
