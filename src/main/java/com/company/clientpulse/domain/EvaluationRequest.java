package com.company.clientpulse.domain;

import com.company.clientpulse.domain.enums.ClientType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class EvaluationRequest {
    public static final String KEY_SEPARATOR = "/";

    private final String network;
    private final String client;
    private final ClientType clientType;
    private final String channel;

    /**
     * Key the queue deduplicates on. Client type is not part of it: a network/client pair
     * is registered at most once. Network names contain dashes, so the separator is a slash.
     */
    public String targetKey() {
        return targetKey(network, client);
    }

    public static String targetKey(String network, String client) {
        return network + KEY_SEPARATOR + client;
    }

    public static EvaluationRequest of(MonitoredTarget target) {
        return EvaluationRequest.builder()
                .network(target.getNetwork())
                .client(target.getClient())
                .clientType(target.getClientType())
                .channel(target.getChannel())
                .build();
    }
}
