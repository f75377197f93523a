package com.company.clientpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "pulse.grafana")
public class GrafanaProperties {
    private String baseUrl = "https://grafana.observability.ethpandaops.io";
    private String datasourceId;
    private String token;
    private String from = "now-5m";
    private String to = "now";
}
