package com.company.clientpulse.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientSummary {
    private String clientName;
    private String clientVersion;
    private int totalTests;
    private int passedTests;
    private int failedTests;
    private double passRate;
    private List<String> testTypes;
}
