package com.company.dashboard.service;

import com.company.dashboard.dto.response.ClientCatalogEntry;
import com.company.dashboard.exception.ClientAliasNotFoundException;
import com.company.dashboard.support.DashboardFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientAliasServiceTest {

    private DashboardFixture fixture;
    private ClientAliasService service;

    @BeforeEach
    void setUp() {
        fixture = DashboardFixture.withSchema();
        service = fixture.aliasService;
    }

    @Test
    void upsertInsertsThenUpdates() {
        service.upsert(7, "  Hotel Sol ");
        assertThat(fixture.aliasResolver.resolve(7)).isEqualTo("Hotel Sol");

        ClientCatalogEntry updated = service.upsert(7, "Hotel Sol Beach");

        assertThat(updated.getDisplayName()).isEqualTo("Hotel Sol Beach");
        assertThat(fixture.aliasRepository.findAll()).containsExactly(Map.entry(7, "Hotel Sol Beach"));
    }

    @Test
    void blankAliasIsRejected() {
        assertThatThrownBy(() -> service.upsert(7, "   "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void catalogJoinsLedgerClientsWithAliases() {
        fixture.records
                .load(LocalDateTime.of(2024, 1, 2, 8, 0), 7, 100, 1)
                .load(LocalDateTime.of(2024, 1, 2, 9, 0), 3, 50, 1)
                .load(LocalDateTime.of(2024, 1, 2, 9, 30), 7, 50, 1)
                .alias(7, "Hotel Sol")
                .alias(12, "Hospital Norte");

        List<ClientCatalogEntry> catalog = service.catalog();

        assertThat(catalog).extracting(ClientCatalogEntry::getClientId).containsExactly(3, 7, 12);
        assertThat(catalog.get(0).getAlias()).isNull();
        assertThat(catalog.get(0).getDisplayName()).isEqualTo("Client 3");
        assertThat(catalog.get(1).getDisplayName()).isEqualTo("Hotel Sol");
    }

    @Test
    void deleteRemovesAliasAndRestoresFallback() {
        fixture.records.alias(7, "Hotel Sol");

        service.delete(7);

        assertThat(fixture.aliasResolver.resolve(7)).isEqualTo("Client 7");
    }

    @Test
    void deletingUnknownAliasFails() {
        assertThatThrownBy(() -> service.delete(99))
                .isInstanceOf(ClientAliasNotFoundException.class)
                .hasMessageContaining("99");
    }
}
