package com.company.dashboard.exception;

public class ClientAliasNotFoundException extends RuntimeException {
    public ClientAliasNotFoundException(int clientId) {
        super("No alias registered for client " + clientId);
    }
}
