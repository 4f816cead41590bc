package com.cosign.chain;

import com.cosign.domain.ChainId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Chain clients by chain. A chain without RPC endpoints has no client.
 */
public class ChainClientRegistry {

    private final Map<ChainId, ChainClient> clients;

    public ChainClientRegistry(Map<ChainId, ChainClient> clients) {
        this.clients = clients.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new EnumMap<>(clients));
    }

    public Optional<ChainClient> find(ChainId chain) {
        return Optional.ofNullable(clients.get(chain));
    }

    public boolean supports(ChainId chain) {
        return clients.containsKey(chain);
    }
}
