package com.company.clientpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "pulse.notify")
public class NotificationProperties {

    /**
     * Notify when the client only shows up in unexplained issues, not as a root cause.
     */
    private boolean alertUnexplained = true;

    /**
     * Check detail keys whose lines name affected nodes.
     */
    private List<String> detailKeys = new ArrayList<>(List.of(
            "lowPeerNodes", "notSyncedNodes", "stuckNodes", "behindNodes"));

    private String webhookUrl;

    /**
     * Optional image attached to alerts; formatted with network and client.
     */
    private String imageUrlTemplate;
}
