package com.company.clientpulse.service;

import com.company.clientpulse.config.ClientCatalog;
import com.company.clientpulse.domain.ClientMention;
import com.company.clientpulse.exception.MentionNotFoundException;
import com.company.clientpulse.exception.StoreException;
import com.company.clientpulse.exception.UnknownClientException;
import com.company.clientpulse.repository.MentionsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Manages who gets mentioned in a client's alerts. Adding to a client with no mentions yet
 * creates an enabled entry; enabling or disabling one creates an empty entry.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MentionService {

    private final MentionsRepository mentionsRepository;
    private final ClientCatalog clientCatalog;
    private final Clock clock;

    public ClientMention add(String network, String client, Collection<String> mentions) {
        ClientMention mention = getOrCreate(network, client, true);
        for (String m : mentions) {
            if (!m.isBlank() && !mention.getMentions().contains(m)) {
                mention.getMentions().add(m);
            }
        }
        return save(mention);
    }

    public ClientMention remove(String network, String client, Collection<String> mentions) {
        ClientMention mention = get(network, client);
        mention.getMentions().removeAll(mentions);
        return save(mention);
    }

    public ClientMention setEnabled(String network, String client, boolean enabled) {
        ClientMention mention = getOrCreate(network, client, enabled);
        mention.setEnabled(enabled);
        log.info("{} mentions for {} on {}", enabled ? "Enabled" : "Disabled", client, network);
        return save(mention);
    }

    public void purge(String network, String client) {
        get(network, client);
        mentionsRepository.purge(network, client);
    }

    public ClientMention get(String network, String client) {
        return mentionsRepository.get(network, client)
                .orElseThrow(() -> new MentionNotFoundException(network, client));
    }

    public List<ClientMention> list(String network) {
        List<ClientMention> mentions = mentionsRepository.list();
        if (network == null || network.isBlank()) {
            return mentions;
        }
        return mentions.stream()
                .filter(m -> network.equals(m.getNetwork()))
                .collect(Collectors.toList());
    }

    /**
     * Mentions to attach to an alert, empty unless configured and enabled. A store failure
     * also yields none, so mentions never hold back an alert.
     */
    public List<String> activeMentions(String network, String client) {
        try {
            return mentionsRepository.get(network, client)
                    .filter(ClientMention::isEnabled)
                    .map(m -> new ArrayList<>(m.getMentions()))
                    .orElseGet(ArrayList::new);
        } catch (StoreException e) {
            log.warn("Could not load mentions for {} on {}: {}", client, network, e.getMessage());
            return new ArrayList<>();
        }
    }

    private ClientMention getOrCreate(String network, String client, boolean enabled) {
        if (clientCatalog.typeOf(client).isEmpty()) {
            throw new UnknownClientException(client);
        }
        Instant now = clock.instant();
        return mentionsRepository.get(network, client)
                .orElseGet(() -> ClientMention.builder()
                        .network(network)
                        .client(client)
                        .mentions(new ArrayList<>())
                        .enabled(enabled)
                        .createdAt(now)
                        .build());
    }

    private ClientMention save(ClientMention mention) {
        mention.setUpdatedAt(clock.instant());
        mentionsRepository.persist(mention);
        log.debug("Mentions for {} on {}: {}", mention.getClient(), mention.getNetwork(), mention.getMentions());
        return mention;
    }
}
