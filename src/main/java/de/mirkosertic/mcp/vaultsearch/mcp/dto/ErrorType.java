package de.mirkosertic.mcp.vaultsearch.mcp.dto;

/**
 * Failure classes reported to tool callers.
 */
public enum ErrorType {
    /** The request itself was invalid and must be corrected. */
    BAD_REQUEST,
    /** The search did not finish within the configured time budget. */
    TIMEOUT,
    INTERNAL
}
