package com.company.clientpulse.domain.enums;

public enum CheckStatus {
    PASS,
    FAIL
}
