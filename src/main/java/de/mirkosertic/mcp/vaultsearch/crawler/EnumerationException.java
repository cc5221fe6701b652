package de.mirkosertic.mcp.vaultsearch.crawler;

import java.io.IOException;

/**
 * Listing the secret tree did not complete, so the set of discovered paths is incomplete.
 */
public class EnumerationException extends IOException {

    public EnumerationException(final String message) {
        super(message);
    }

    public EnumerationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
