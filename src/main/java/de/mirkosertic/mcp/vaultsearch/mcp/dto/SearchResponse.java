package de.mirkosertic.mcp.vaultsearch.mcp.dto;

import java.util.List;

/**
 * Response DTO for the search tool.
 */
public record SearchResponse(
        boolean success,
        List<String> matches,
        int matchCount,
        long searchTimeMs,
        ErrorType errorType,
        String error
) implements ToolResponse {

    public static SearchResponse success(final List<String> matches, final long searchTimeMs) {
        return new SearchResponse(true, matches, matches.size(), searchTimeMs, null, null);
    }

    public static SearchResponse error(final ErrorType errorType, final String errorMessage) {
        return new SearchResponse(false, null, 0, 0, errorType, errorMessage);
    }
}
