package com.company.clientpulse.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestTypeRegression {
    private String testType;
    private int previousFails;
    private int currentFails;
    private int increase;
    private double failRate;

    public String describe() {
        return String.format(Locale.ROOT, "`%s` (+%d, %.1f%% fail rate)", testType, increase, failRate);
    }
}
