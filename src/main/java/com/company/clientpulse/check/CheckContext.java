package com.company.clientpulse.check;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run inputs for checks plus the run log that explains how the verdict was reached.
 */
@Getter
public class CheckContext {

    /**
     * Matches every client in label selectors.
     */
    public static final String ALL_CLIENTS = ".*";

    private final String checkId;
    private final String network;
    private final String consensusClient;
    private final String executionClient;
    private final List<String> log;

    public CheckContext(String checkId, String network, String consensusClient, String executionClient) {
        this(checkId, network, consensusClient, executionClient, new ArrayList<>());
    }

    private CheckContext(String checkId, String network, String consensusClient, String executionClient,
                         List<String> log) {
        this.checkId = checkId;
        this.network = network;
        this.consensusClient = consensusClient;
        this.executionClient = executionClient;
        this.log = log;
    }

    /**
     * Same run and log, with every client selected.
     */
    public CheckContext forAllClients() {
        return new CheckContext(checkId, network, ALL_CLIENTS, ALL_CLIENTS, log);
    }

    public void print(String format, Object... args) {
        log.add(args.length == 0 ? format : String.format(format, args));
    }

    public List<String> getLog() {
        return Collections.unmodifiableList(log);
    }
}
