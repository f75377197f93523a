package com.company.clientpulse.repository;

import com.company.clientpulse.domain.CheckArtifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Check run artifacts at {@code <prefix>/networks/<network>/checks/<checkId>.json}.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class CheckArtifactRepository {

    private static final String REPOSITORY = "checks";

    private final S3ObjectStore store;

    public void persist(CheckArtifact artifact) {
        store.write(key(artifact.getNetwork(), artifact.getCheckId()), artifact, REPOSITORY);
        log.debug("Persisted check artifact {} for {} on {}",
                artifact.getCheckId(), artifact.getClient(), artifact.getNetwork());
    }

    public Optional<CheckArtifact> get(String network, String checkId) {
        return store.read(key(network, checkId), CheckArtifact.class, REPOSITORY);
    }

    /**
     * Looks the check up across all networks.
     */
    public Optional<CheckArtifact> find(String checkId) {
        String suffix = "/checks/" + checkId + ".json";
        return store.listKeys(store.key("networks/"), REPOSITORY).stream()
                .filter(key -> key.endsWith(suffix))
                .findFirst()
                .flatMap(key -> store.read(key, CheckArtifact.class, REPOSITORY));
    }

    public void purge(String network, String checkId) {
        store.delete(key(network, checkId), REPOSITORY);
        log.info("Purged check artifact {} on {}", checkId, network);
    }

    String key(String network, String checkId) {
        return store.key(String.format("networks/%s/checks/%s.json", network, checkId));
    }
}
