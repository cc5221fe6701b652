package de.mirkosertic.mcp.vaultsearch.index;

import java.util.List;

/**
 * Indexed form of one secret: its key names and the lowercase string searches run against.
 */
public record SecretRecord(
        /** Every key name found in the secret, in discovery order, duplicates kept. */
        List<String> allKeys,
        /** Lowercase path followed by the lowercase keys, space separated. */
        String searchString
) {
    public SecretRecord {
        allKeys = List.copyOf(allKeys);
    }
}
