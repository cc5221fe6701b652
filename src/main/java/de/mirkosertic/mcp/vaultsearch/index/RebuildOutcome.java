package de.mirkosertic.mcp.vaultsearch.index;

/**
 * Answer to a rebuild request.
 */
public enum RebuildOutcome {
    /** A new rebuild was started. */
    ACCEPTED,
    /** Another rebuild is running; nothing was started. */
    ALREADY_IN_PROGRESS
}
