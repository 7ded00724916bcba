package com.company.dashboard.service;

import com.company.dashboard.domain.ClientAliasSnapshot;
import com.company.dashboard.repository.ClientAliasRepository;
import com.company.dashboard.service.aggregation.SourceFailureHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read-only view of the client alias store. Each call reads the store afresh.
 */
@Service
@RequiredArgsConstructor
public class ClientAliasResolver {

    private final ClientAliasRepository aliasRepository;
    private final SourceFailureHandler failureHandler;

    public String resolve(int clientId) {
        return snapshot().resolve(clientId);
    }

    public ClientAliasSnapshot snapshot() {
        return failureHandler.absorb("aliasSnapshot",
                () -> ClientAliasSnapshot.of(aliasRepository.findAll()),
                ClientAliasSnapshot.empty());
    }
}
