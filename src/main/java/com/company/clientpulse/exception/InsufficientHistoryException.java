package com.company.clientpulse.exception;

/**
 * Fewer than two dated snapshots exist for a network, so there is nothing to compare against.
 */
public class InsufficientHistoryException extends RuntimeException {
    public InsufficientHistoryException(String network, int available) {
        super(String.format("Insufficient history for network %s: %d snapshot(s), need at least 2",
                network, available));
    }
}
