package de.mirkosertic.mcp.vaultsearch.vault;

/**
 * Vault refused the request for the configured token (HTTP 403).
 */
public class PermissionDeniedException extends VaultAccessException {

    public PermissionDeniedException(final String message, final Throwable cause) {
        super(message, 403, cause);
    }
}
