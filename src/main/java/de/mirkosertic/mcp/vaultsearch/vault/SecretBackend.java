package de.mirkosertic.mcp.vaultsearch.vault;

import de.mirkosertic.mcp.vaultsearch.extract.SecretValue;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Read-only view of a hierarchical secret store.
 */
public interface SecretBackend {

    /**
     * Lists the direct children of a collection. Names ending in {@code /} are
     * sub-collections, all others are secrets.
     *
     * @param path collection path relative to the mount, {@code ""} for the root
     * @return child names, empty if the collection has no children
     * @throws PermissionDeniedException if the token may not list this collection
     * @throws VaultAccessException on any other backend failure
     */
    List<String> list(String path) throws IOException;

    /**
     * Reads the fields of one secret.
     *
     * @param path secret path relative to the mount
     * @return the secret fields, or {@code null} if the secret has no data
     * @throws PermissionDeniedException if the token may not read this secret
     * @throws VaultAccessException on any other backend failure
     */
    @Nullable SecretValue read(String path) throws IOException;
}
