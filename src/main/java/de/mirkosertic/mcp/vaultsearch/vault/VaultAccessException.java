package de.mirkosertic.mcp.vaultsearch.vault;

import java.io.IOException;

/**
 * A request to Vault failed. Carries the HTTP status when Vault answered at all.
 */
public class VaultAccessException extends IOException {

    public static final int NO_STATUS = -1;

    private final int statusCode;

    public VaultAccessException(final String message, final int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public VaultAccessException(final String message, final int statusCode, final Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
