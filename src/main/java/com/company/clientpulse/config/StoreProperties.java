package com.company.clientpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "pulse.store")
public class StoreProperties {
    private String bucket;
    private String prefix = "client-pulse";
    private String region = "us-east-1";
    private String endpoint;
    private boolean pathStyleAccess;
    private String accessKey;
    private String secretKey;
    private Duration apiCallTimeout = Duration.ofSeconds(30);
}
