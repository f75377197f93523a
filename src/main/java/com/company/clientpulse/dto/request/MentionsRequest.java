package com.company.clientpulse.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MentionsRequest {
    @NotEmpty(message = "At least one mention is required")
    private List<@NotBlank(message = "Mentions must not be blank") String> mentions;
}
