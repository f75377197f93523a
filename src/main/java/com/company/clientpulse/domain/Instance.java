package com.company.clientpulse.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A node named in check output, scoped to the network and client under evaluation.
 * Two instances are equal when their names are.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Instance implements Comparable<Instance> {

    @EqualsAndHashCode.Include
    private final String name;
    private final String network;
    private final String client;

    public Instance(String name, String network, String client) {
        this.name = name;
        this.network = network;
        this.client = client;
    }

    public String hostname(String domain) {
        return String.format("%s.%s.%s", name, network, domain);
    }

    public String sshCommand(String user, String domain) {
        return String.format("ssh %s@%s", user, hostname(domain));
    }

    @Override
    public int compareTo(Instance other) {
        return name.compareTo(other.name);
    }
}
