package de.mirkosertic.mcp.vaultsearch.vault;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

public final class VaultErrors {

    private VaultErrors() {
    }

    /**
     * True for 403-class failures. Uses the HTTP status where one was recorded and
     * falls back to the error text for failures that only carry a message.
     */
    public static boolean isPermissionDenied(final @Nullable Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof PermissionDeniedException) {
            return true;
        }
        if (error instanceof VaultAccessException vaultError && vaultError.getStatusCode() == 403) {
            return true;
        }
        final String message = error.getMessage();
        if (message == null) {
            return false;
        }
        final String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("permission denied") || lower.contains("403");
    }
}
