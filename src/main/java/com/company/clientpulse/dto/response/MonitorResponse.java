package com.company.clientpulse.dto.response;

import com.company.clientpulse.domain.MonitoredTarget;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitorResponse {
    private String network;
    private String client;
    private String clientType;
    private String channel;
    private String schedule;
    private boolean enabled;
    private String lastCheckId;
    private String state;
    private Instant createdAt;
    private Instant updatedAt;

    public static MonitorResponse from(MonitoredTarget target, String state) {
        return MonitorResponse.builder()
                .network(target.getNetwork())
                .client(target.getClient())
                .clientType(target.getClientType() == null ? null : target.getClientType().getShortName())
                .channel(target.getChannel())
                .schedule(target.getSchedule())
                .enabled(target.isEnabled())
                .lastCheckId(target.getLastCheckId())
                .state(state)
                .createdAt(target.getCreatedAt())
                .updatedAt(target.getUpdatedAt())
                .build();
    }
}
