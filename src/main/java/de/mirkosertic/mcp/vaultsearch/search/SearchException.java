package de.mirkosertic.mcp.vaultsearch.search;

/**
 * A search could not produce a result.
 */
public class SearchException extends Exception {

    public SearchException(final String message) {
        super(message);
    }

    public SearchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
