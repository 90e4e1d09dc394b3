package com.example.merchant.security;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Trusted agent keys, looked up by agent identifier.
 * <p>
 * The table is an immutable map swapped as a whole by {@link #replaceAll(Collection)}, so a
 * verification that already looked up a key keeps using the snapshot it started with.
 */
public class TrustedAgentKeyStore {

    private final AtomicReference<Map<String, TrustedAgentKey>> keys = new AtomicReference<>(Map.of());

    public TrustedAgentKeyStore(Collection<TrustedAgentKey> initialKeys) {
        replaceAll(initialKeys);
    }

    public Optional<TrustedAgentKey> lookup(String agentIdentifier) {
        if (agentIdentifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get().get(agentIdentifier));
    }

    /**
     * Replace the whole table.
     *
     * @throws IllegalArgumentException if two keys share an agent identifier
     */
    public void replaceAll(Collection<TrustedAgentKey> newKeys) {
        Map<String, TrustedAgentKey> table = new LinkedHashMap<>();
        for (TrustedAgentKey key : newKeys) {
            if (table.putIfAbsent(key.agentIdentifier(), key) != null) {
                throw new IllegalArgumentException("Duplicate trusted agent: " + key.agentIdentifier());
            }
        }
        keys.set(Map.copyOf(table));
    }

    public List<TrustedAgentKey> all() {
        return List.copyOf(keys.get().values());
    }

    public int size() {
        return keys.get().size();
    }

}
