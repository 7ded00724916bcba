package com.company.dashboard.exception;

import lombok.Getter;

/**
 * A record source could not be queried (connection failure, statement timeout, bad schema).
 */
@Getter
public class SourceUnavailableException extends RuntimeException {

    private final String source;

    public SourceUnavailableException(String source, Throwable cause) {
        super("Record source unavailable: " + source, cause);
        this.source = source;
    }
}
