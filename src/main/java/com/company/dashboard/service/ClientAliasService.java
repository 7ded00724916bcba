package com.company.dashboard.service;

import com.company.dashboard.domain.ClientAliasSnapshot;
import com.company.dashboard.dto.response.ClientCatalogEntry;
import com.company.dashboard.exception.ClientAliasNotFoundException;
import com.company.dashboard.repository.ClientAliasRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Alias maintenance backing the client management endpoints. Unlike the read path,
 * failures here surface to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClientAliasService {

    private final ClientAliasRepository aliasRepository;

    /**
     * Every client seen in the load ledger or holding an alias, ascending by id.
     */
    public List<ClientCatalogEntry> catalog() {
        Map<Integer, String> aliases = aliasRepository.findAll();
        ClientAliasSnapshot snapshot = ClientAliasSnapshot.of(aliases);

        TreeSet<Integer> clientIds = new TreeSet<>(aliasRepository.findDistinctLoadClientIds());
        clientIds.addAll(aliases.keySet());

        List<ClientCatalogEntry> entries = new ArrayList<>(clientIds.size());
        for (Integer clientId : clientIds) {
            entries.add(ClientCatalogEntry.builder()
                    .clientId(clientId)
                    .alias(snapshot.aliasOf(clientId))
                    .displayName(snapshot.resolve(clientId))
                    .build());
        }
        return entries;
    }

    @Transactional
    public ClientCatalogEntry upsert(int clientId, String alias) {
        String trimmed = alias == null ? "" : alias.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Alias must not be blank");
        }
        if (aliasRepository.update(clientId, trimmed) == 0) {
            aliasRepository.insert(clientId, trimmed);
            log.info("Alias created for client {}", clientId);
        } else {
            log.info("Alias updated for client {}", clientId);
        }

        return ClientCatalogEntry.builder()
                .clientId(clientId)
                .alias(trimmed)
                .displayName(trimmed)
                .build();
    }

    @Transactional
    public void delete(int clientId) {
        if (aliasRepository.delete(clientId) == 0) {
            throw new ClientAliasNotFoundException(clientId);
        }
        log.info("Alias removed for client {}", clientId);
    }
}
