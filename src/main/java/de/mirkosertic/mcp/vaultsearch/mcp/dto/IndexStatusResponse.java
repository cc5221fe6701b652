package de.mirkosertic.mcp.vaultsearch.mcp.dto;

/**
 * Response DTO for the getIndexStatus tool.
 */
public record IndexStatusResponse(
        boolean success,
        String version,
        boolean rebuilding,
        String buildDuration,
        String cacheAge,
        long approxSizeBytes,
        String approxSize,
        long indexedSecrets,
        long fetched,
        long total,
        long totalKeysIndexed,
        int progressPercent,
        String lastCompletedBuild,
        String lastRebuildError,
        String error
) implements ToolResponse {

    public static IndexStatusResponse error(final String errorMessage) {
        return new IndexStatusResponse(false, null, false, null, null, 0, null, 0, 0, 0, 0, 0, null, null,
                errorMessage);
    }
}
