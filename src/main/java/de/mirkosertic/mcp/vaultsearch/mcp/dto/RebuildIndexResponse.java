package de.mirkosertic.mcp.vaultsearch.mcp.dto;

/**
 * Response DTO for the rebuildIndex tool. Starting a rebuild while one is running is not an error.
 */
public record RebuildIndexResponse(
        boolean success,
        String status,
        String message,
        String error
) implements ToolResponse {

    public static final String ACCEPTED = "accepted";
    public static final String ALREADY_IN_PROGRESS = "already_in_progress";

    public static RebuildIndexResponse accepted() {
        return new RebuildIndexResponse(true, ACCEPTED, "Index rebuild started", null);
    }

    public static RebuildIndexResponse alreadyInProgress() {
        return new RebuildIndexResponse(true, ALREADY_IN_PROGRESS, "Index rebuild already in progress", null);
    }

    public static RebuildIndexResponse error(final String errorMessage) {
        return new RebuildIndexResponse(false, null, null, errorMessage);
    }
}
