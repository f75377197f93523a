package com.company.clientpulse.config;

import com.company.clientpulse.domain.enums.CheckCategory;
import com.company.clientpulse.domain.enums.ClientType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Query-backed health checks. Each query is a format string taking network, consensus client
 * and execution client regexes, in that order.
 */
@Data
@ConfigurationProperties(prefix = "pulse.checks")
public class ChecksProperties {

    private List<Definition> definitions = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Definition {
        private String name;
        private CheckCategory category;
        private ClientType clientType;
        private String detailKey;
        private String failureDescription;
        private String successDescription;
        private String query;
    }
}
