package de.mirkosertic.mcp.vaultsearch.search;

import java.time.Duration;

public class SearchTimeoutException extends SearchException {

    private final Duration timeout;

    public SearchTimeoutException(final Duration timeout) {
        super("Search timeout exceeded");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
