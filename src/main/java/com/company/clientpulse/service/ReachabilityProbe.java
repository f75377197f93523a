package com.company.clientpulse.service;

import com.company.clientpulse.domain.enums.ProbeResult;

/**
 * Bounded-time liveness probe against a host's administrative port.
 * Implementations never throw; every failure maps to a {@link ProbeResult}.
 */
public interface ReachabilityProbe {
    ProbeResult probe(String host);
}
