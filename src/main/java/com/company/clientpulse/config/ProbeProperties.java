package com.company.clientpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Where instances live and how their reachability is probed.
 */
@Data
@ConfigurationProperties(prefix = "pulse.probe")
public class ProbeProperties {
    private String domain = "ethpandaops.io";
    private String sshUser = "devops";
    private int port = 22;
    private Duration connectTimeout = Duration.ofSeconds(2);
    private Duration readTimeout = Duration.ofSeconds(3);
    private String bannerPrefix = "SSH-";
    private int bannerLength = 8;
    private int parallelism = 8;
}
