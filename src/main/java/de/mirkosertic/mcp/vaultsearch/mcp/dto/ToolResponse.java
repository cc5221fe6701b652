package de.mirkosertic.mcp.vaultsearch.mcp.dto;

/**
 * Common shape of all tool responses.
 */
public interface ToolResponse {

    boolean success();
}
