package com.company.clientpulse.domain;

import com.company.clientpulse.domain.enums.ClientType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A registered (network, client) pair under monitoring, stored as JSON in the registration store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MonitoredTarget {
    private String network;
    private String client;
    private ClientType clientType;
    private String channel;
    private String schedule;
    @Builder.Default
    private boolean enabled = true;
    private String lastCheckId;
    private Instant createdAt;
    private Instant updatedAt;

    public String targetKey() {
        return EvaluationRequest.targetKey(network, client);
    }
}
