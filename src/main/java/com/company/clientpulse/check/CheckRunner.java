package com.company.clientpulse.check;

import com.company.clientpulse.domain.CheckRun;
import com.company.clientpulse.domain.enums.ClientType;

public interface CheckRunner {

    /**
     * Runs every check for the network and correlates the failures for the target client.
     *
     * @throws com.company.clientpulse.exception.CheckExecutionException if any check fails to execute
     */
    CheckRun run(String network, String client, ClientType clientType);
}
