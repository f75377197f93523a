package com.company.clientpulse.service;

import com.company.clientpulse.domain.NotificationPayload;

/**
 * Delivers an alert to a channel. Delivery is best effort: implementations log and drop on failure.
 */
public interface NotificationSink {

    /**
     * @return true when the payload was handed off
     */
    boolean send(String channel, NotificationPayload payload);
}
