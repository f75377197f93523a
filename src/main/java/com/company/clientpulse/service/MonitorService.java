package com.company.clientpulse.service;

import com.company.clientpulse.config.ClientCatalog;
import com.company.clientpulse.domain.MonitoredTarget;
import com.company.clientpulse.domain.enums.ClientType;
import com.company.clientpulse.exception.MonitorNotFoundException;
import com.company.clientpulse.exception.UnknownClientException;
import com.company.clientpulse.repository.MonitorRepository;
import com.company.clientpulse.scheduled.EvaluationScheduler;
import com.company.clientpulse.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Registration of monitored network/client pairs. Keeps the scheduler in step with the store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonitorService {

    private final MonitorRepository monitorRepository;
    private final ClientCatalog clientCatalog;
    private final ObjectProvider<EvaluationScheduler> scheduler;
    private final Clock clock;

    /**
     * Creates or replaces the monitor for a network/client pair. Re-registering keeps the original
     * creation time and last check id.
     */
    public MonitoredTarget register(String network, String client, String channel, String schedule) {
        ClientType clientType = clientCatalog.typeOf(client)
                .orElseThrow(() -> new UnknownClientException(client));

        if (schedule != null && !schedule.isBlank()
                && !CronExpression.isValidExpression(TimeUtils.toSpringCron(schedule))) {
            throw new IllegalArgumentException("Invalid cron schedule: " + schedule);
        }

        Instant now = clock.instant();
        MonitoredTarget target = monitorRepository.get(network, client)
                .orElseGet(() -> MonitoredTarget.builder()
                        .network(network)
                        .client(client)
                        .createdAt(now)
                        .build());

        target.setClientType(clientType);
        target.setChannel(channel);
        target.setSchedule(schedule);
        target.setEnabled(true);
        target.setUpdatedAt(now);

        monitorRepository.persist(target);
        scheduler.ifAvailable(s -> s.schedule(target));

        log.info("Registered {} monitor for {} on {} (channel {}, schedule {})",
                clientType.getShortName(), client, network, channel, schedule == null ? "default" : schedule);
        return target;
    }

    public void deregister(String network, String client) {
        MonitoredTarget target = get(network, client);

        scheduler.ifAvailable(s -> s.unschedule(target.targetKey()));
        monitorRepository.purge(network, client);
    }

    public MonitoredTarget get(String network, String client) {
        return monitorRepository.get(network, client)
                .orElseThrow(() -> new MonitorNotFoundException(network, client));
    }

    public List<MonitoredTarget> list(String network) {
        List<MonitoredTarget> targets = monitorRepository.list();
        if (network == null || network.isBlank()) {
            return targets;
        }
        return targets.stream()
                .filter(t -> network.equals(t.getNetwork()))
                .collect(Collectors.toList());
    }
}
