package com.company.clientpulse.event;

import com.company.clientpulse.domain.EvaluationOutcome;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class EvaluationCompletedEvent {
    private final EvaluationOutcome outcome;
}
