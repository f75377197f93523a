package com.company.clientpulse.repository;

import com.company.clientpulse.domain.ClientMention;
import com.company.clientpulse.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Client mentions at {@code <prefix>/networks/<network>/mentions/<client>.json}.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class MentionsRepository {

    private static final String REPOSITORY = "mentions";
    private static final String CATEGORY = "/mentions/";

    private final S3ObjectStore store;

    public List<ClientMention> list() {
        List<ClientMention> mentions = new ArrayList<>();

        for (String key : store.listKeys(store.key("networks/"), REPOSITORY)) {
            if (!key.endsWith(".json") || !key.contains(CATEGORY)) {
                continue;
            }
            try {
                store.read(key, ClientMention.class, REPOSITORY).ifPresent(mentions::add);
            } catch (StoreException e) {
                log.error("Failed to load mentions {}", key, e);
            }
        }

        mentions.sort(Comparator.comparing(ClientMention::getNetwork).thenComparing(ClientMention::getClient));
        return mentions;
    }

    public Optional<ClientMention> get(String network, String client) {
        return store.read(key(network, client), ClientMention.class, REPOSITORY);
    }

    public void persist(ClientMention mention) {
        store.write(key(mention.getNetwork(), mention.getClient()), mention, REPOSITORY);
    }

    public void purge(String network, String client) {
        store.delete(key(network, client), REPOSITORY);
        log.info("Purged mentions for {} on {}", client, network);
    }

    String key(String network, String client) {
        return store.key(String.format("networks/%s/mentions/%s.json", network, client));
    }
}
