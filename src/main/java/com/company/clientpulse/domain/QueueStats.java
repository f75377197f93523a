package com.company.clientpulse.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Point-in-time view of the evaluation queue counters.
 */
@Getter
@Builder
@ToString
public class QueueStats {
    private final boolean running;
    private final long enqueued;
    private final long rejected;
    private final long started;
    private final long succeeded;
    private final long failed;
    private final long notificationsSent;
    private final long inFlight;
    private final int queueDepth;
    private final int workers;
    private final int capacity;
}
