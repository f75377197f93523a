package com.company.clientpulse.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Users or groups to mention in every alert for a client on a network.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientMention {
    private String network;
    private String client;
    @Builder.Default
    private List<String> mentions = new ArrayList<>();
    private boolean enabled;
    private Instant createdAt;
    private Instant updatedAt;
}
