package de.mirkosertic.mcp.vaultsearch.search;

/**
 * The caller supplied criteria that cannot be evaluated. The message is meant for the caller.
 */
public class InvalidSearchCriteriaException extends SearchException {

    public InvalidSearchCriteriaException(final String message) {
        super(message);
    }

    public InvalidSearchCriteriaException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
