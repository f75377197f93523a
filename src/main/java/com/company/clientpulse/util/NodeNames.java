package com.company.clientpulse.util;

/**
 * Parsing helpers for node names of the form {@code <consensus>-<execution>-<index>}.
 */
public final class NodeNames {

    private NodeNames() {
    }

    /**
     * Extracts the node name from one line of a node listing, e.g. {@code "nimbus-geth-1 (peers: 0)"}
     * or {@code "(ingress) nimbus-geth-1"}. Returns null when the line holds no usable name.
     */
    public static String instanceFromLine(String line) {
        if (line == null) {
            return null;
        }
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length == 0 || tokens[0].isEmpty()) {
            return null;
        }

        String candidate = tokens[0];
        if (candidate.startsWith("(") && tokens.length > 1) {
            candidate = tokens[1];
        }

        int annotation = candidate.indexOf('(');
        if (annotation > 0) {
            candidate = candidate.substring(0, annotation);
        }

        return candidate.split("-").length < 2 ? null : candidate;
    }

    /**
     * True when the consensus or the execution component of the name is exactly the client.
     */
    public static boolean belongsTo(String instance, String client) {
        String[] parts = instance.split("-");
        if (parts.length < 2) {
            return false;
        }
        return parts[0].equals(client) || parts[1].equals(client);
    }

    public static String consensusClient(String instance) {
        String[] parts = instance.split("-");
        return parts.length < 2 ? null : parts[0];
    }

    public static String executionClient(String instance) {
        String[] parts = instance.split("-");
        return parts.length < 2 ? null : parts[1];
    }
}
