package com.company.clientpulse.domain.enums;

/**
 * Per-key lifecycle inside the evaluation queue: IDLE -> QUEUED -> RUNNING -> IDLE.
 */
public enum TargetState {
    IDLE,
    QUEUED,
    RUNNING
}
