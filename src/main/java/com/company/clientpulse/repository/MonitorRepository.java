package com.company.clientpulse.repository;

import com.company.clientpulse.domain.MonitoredTarget;
import com.company.clientpulse.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Registered monitors, one JSON document per network/client at
 * {@code <prefix>/networks/<network>/alerts/<client>.json}.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class MonitorRepository {

    private static final String REPOSITORY = "monitor";
    private static final String CATEGORY = "/alerts/";

    private final S3ObjectStore store;

    public List<MonitoredTarget> list() {
        List<MonitoredTarget> targets = new ArrayList<>();

        for (String key : store.listKeys(store.key("networks/"), REPOSITORY)) {
            if (!key.endsWith(".json") || !key.contains(CATEGORY)) {
                continue;
            }
            try {
                store.read(key, MonitoredTarget.class, REPOSITORY).ifPresent(targets::add);
            } catch (StoreException e) {
                log.error("Failed to load monitor {}", key, e);
            }
        }

        targets.sort(Comparator.comparing(MonitoredTarget::getNetwork).thenComparing(MonitoredTarget::getClient));
        return targets;
    }

    public Optional<MonitoredTarget> get(String network, String client) {
        return store.read(key(network, client), MonitoredTarget.class, REPOSITORY);
    }

    public void persist(MonitoredTarget target) {
        store.write(key(target.getNetwork(), target.getClient()), target, REPOSITORY);
        log.debug("Persisted monitor {}", target.targetKey());
    }

    public void purge(String network, String client) {
        store.delete(key(network, client), REPOSITORY);
        log.info("Purged monitor for {} on {}", client, network);
    }

    String key(String network, String client) {
        return store.key(String.format("networks/%s/alerts/%s.json", network, client));
    }
}
