package com.company.clientpulse.check;

import com.company.clientpulse.domain.CheckResult;
import com.company.clientpulse.domain.enums.CheckCategory;
import com.company.clientpulse.domain.enums.ClientType;

/**
 * A single health signal evaluated against a network.
 */
public interface HealthCheck {

    String name();

    CheckCategory category();

    /**
     * Layer whose nodes this check reports on.
     */
    ClientType clientType();

    /**
     * @throws com.company.clientpulse.exception.MetricsQueryException when the metrics backend fails
     */
    CheckResult run(CheckContext context);
}
