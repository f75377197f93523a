package com.company.clientpulse.controller;

import com.company.clientpulse.domain.ClientMention;
import com.company.clientpulse.dto.request.MentionsRequest;
import com.company.clientpulse.service.MentionService;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/mentions")
@Tag(name = "Mentions", description = "Users mentioned in a client's alerts")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class MentionController {

    private final MentionService mentionService;

    @GetMapping
    @Operation(summary = "List mentions", description = "Optionally restricted to one network")
    @PreAuthorize("hasAnyRole('PULSE_READER', 'PULSE_OPERATOR')")
    public ResponseEntity<List<ClientMention>> list(@RequestParam(required = false) String network) {
        return ResponseEntity.ok(mentionService.list(network));
    }

    @GetMapping("/{network}/{client}")
    @Operation(summary = "Get a client's mentions")
    @PreAuthorize("hasAnyRole('PULSE_READER', 'PULSE_OPERATOR')")
    public ResponseEntity<ClientMention> get(@PathVariable String network, @PathVariable String client) {
        return ResponseEntity.ok(mentionService.get(network, client));
    }

    @PostMapping("/{network}/{client}")
    @Operation(summary = "Add mentions", description = "Creates enabled mentions for the client when it has none")
    @PreAuthorize("hasRole('PULSE_OPERATOR')")
    public ResponseEntity<ClientMention> add(@PathVariable String network,
                                             @PathVariable String client,
                                             @Valid @RequestBody MentionsRequest request) {
        ClientMention mention = mentionService.add(network, client, request.getMentions());
        log.info("Added mentions {} for {} on {}", request.getMentions(), client, network);
        return ResponseEntity.ok(mention);
    }

    @DeleteMapping("/{network}/{client}/entries")
    @Operation(summary = "Remove mentions")
    @PreAuthorize("hasRole('PULSE_OPERATOR')")
    public ResponseEntity<ClientMention> remove(@PathVariable String network,
                                                @PathVariable String client,
                                                @RequestParam("mention") List<String> mentions) {
        ClientMention mention = mentionService.remove(network, client, mentions);
        log.info("Removed mentions {} for {} on {}", mentions, client, network);
        return ResponseEntity.ok(mention);
    }

    @PutMapping("/{network}/{client}/enabled")
    @Operation(summary = "Enable or disable a client's mentions")
    @PreAuthorize("hasRole('PULSE_OPERATOR')")
    public ResponseEntity<ClientMention> setEnabled(@PathVariable String network,
                                                    @PathVariable String client,
                                                    @RequestParam boolean value) {
        return ResponseEntity.ok(mentionService.setEnabled(network, client, value));
    }

    @DeleteMapping("/{network}/{client}")
    @Operation(summary = "Delete a client's mentions")
    @PreAuthorize("hasRole('PULSE_OPERATOR')")
    public ResponseEntity<Void> purge(@PathVariable String network, @PathVariable String client) {
        mentionService.purge(network, client);
        return ResponseEntity.noContent().build();
    }
}
