package com.company.dashboard.controller;

import com.company.dashboard.dto.request.ClientAliasRequest;
import com.company.dashboard.dto.response.ClientCatalogEntry;
import com.company.dashboard.service.ClientAliasService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/clients")
@Tag(name = "Clients", description = "Client catalog and display aliases")
@RequiredArgsConstructor
@Slf4j
public class ClientAliasController {

    private final ClientAliasService aliasService;

    @GetMapping
    @Operation(summary = "List known clients with their aliases")
    public ResponseEntity<List<ClientCatalogEntry>> getCatalog() {
        return ResponseEntity.ok(aliasService.catalog());
    }

    @PutMapping("/{clientId}/alias")
    @Operation(summary = "Create or replace a client alias")
    public ResponseEntity<ClientCatalogEntry> putAlias(
            @PathVariable int clientId,
            @Valid @RequestBody ClientAliasRequest request) {

        log.debug("Alias update requested for client {}", clientId);
        return ResponseEntity.ok(aliasService.upsert(clientId, request.getAlias()));
    }

    @DeleteMapping("/{clientId}/alias")
    @Operation(summary = "Remove a client alias")
    public ResponseEntity<Void> deleteAlias(@PathVariable int clientId) {
        aliasService.delete(clientId);
        return ResponseEntity.noContent().build();
    }
}
