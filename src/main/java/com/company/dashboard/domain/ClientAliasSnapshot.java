package com.company.dashboard.domain;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable copy of the alias store taken once, so every row of one build
 * resolves against the same mapping.
 */
public final class ClientAliasSnapshot {

    private static final ClientAliasSnapshot EMPTY = new ClientAliasSnapshot(Collections.emptyMap());

    private final Map<Integer, String> aliases;

    private ClientAliasSnapshot(Map<Integer, String> aliases) {
        this.aliases = aliases;
    }

    public static ClientAliasSnapshot of(Map<Integer, String> aliases) {
        if (aliases == null || aliases.isEmpty()) {
            return EMPTY;
        }
        return new ClientAliasSnapshot(Collections.unmodifiableMap(new HashMap<>(aliases)));
    }

    public static ClientAliasSnapshot empty() {
        return EMPTY;
    }

    public static String fallbackName(int clientId) {
        return "Client " + clientId;
    }

    public String resolve(int clientId) {
        String alias = aliases.get(clientId);
        if (alias == null || alias.isBlank()) {
            return fallbackName(clientId);
        }
        return alias;
    }

    /**
     * Registered alias, or null when the client has none.
     */
    public String aliasOf(int clientId) {
        return aliases.get(clientId);
    }

    public int size() {
        return aliases.size();
    }
}
