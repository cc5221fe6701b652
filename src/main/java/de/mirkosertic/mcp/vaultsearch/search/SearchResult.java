package de.mirkosertic.mcp.vaultsearch.search;

import java.util.List;

/**
 * Matching secret paths, or UI links to them when decoration was requested.
 */
public record SearchResult(List<String> matches, String uiBaseUrl, long searchTimeMs) {

    public SearchResult {
        matches = List.copyOf(matches);
    }
}
