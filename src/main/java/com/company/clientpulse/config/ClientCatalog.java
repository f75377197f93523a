package com.company.clientpulse.config;

import com.company.clientpulse.domain.enums.ClientType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Known consensus and execution clients, and the ones still considered pre-production.
 * Instances running a pre-production client are reported as likely unrelated.
 */
@Data
@ConfigurationProperties(prefix = "pulse.clients")
public class ClientCatalog {

    private List<String> consensus = new ArrayList<>(List.of(
            "lighthouse", "prysm", "lodestar", "nimbus", "teku", "grandine"));

    private List<String> execution = new ArrayList<>(List.of(
            "nethermind", "nimbusel", "besu", "geth", "reth", "erigon", "ethereumjs"));

    private Set<String> preProduction = new HashSet<>(Set.of("ethereumjs", "nimbusel", "erigonTwo"));

    public boolean isPreProduction(String client) {
        return client != null && preProduction.contains(client);
    }

    public Optional<ClientType> typeOf(String client) {
        if (consensus.contains(client)) {
            return Optional.of(ClientType.CONSENSUS);
        }
        if (execution.contains(client)) {
            return Optional.of(ClientType.EXECUTION);
        }
        return Optional.empty();
    }

    public boolean isKnown(String client) {
        return typeOf(client).isPresent();
    }
}
