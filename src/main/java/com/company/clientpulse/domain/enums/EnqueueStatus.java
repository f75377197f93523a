package com.company.clientpulse.domain.enums;

public enum EnqueueStatus {
    ACCEPTED("Evaluation accepted"),
    ALREADY_RUNNING("An evaluation for this target is already queued or running"),
    QUEUE_FULL("Evaluation queue is at capacity"),
    STOPPED("Evaluation queue is not accepting work");

    private final String description;

    EnqueueStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
