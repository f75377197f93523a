package com.company.clientpulse.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterMonitorRequest {
    @NotBlank(message = "Network is required")
    @Pattern(regexp = "[a-z0-9][a-z0-9-]*", message = "Network must be lowercase alphanumeric with dashes")
    private String network;

    @NotBlank(message = "Client is required")
    private String client;

    @NotBlank(message = "Channel is required")
    private String channel;

    // Five or six field cron; the default schedule applies when absent
    private String schedule;
}
