package com.company.clientpulse.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual evaluation of a network/client pair. The channel defaults to the registered monitor's.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationTriggerRequest {
    @NotBlank(message = "Network is required")
    private String network;

    @NotBlank(message = "Client is required")
    private String client;

    private String channel;
}
