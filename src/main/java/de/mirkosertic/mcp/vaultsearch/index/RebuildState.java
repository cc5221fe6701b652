package de.mirkosertic.mcp.vaultsearch.index;

public enum RebuildState {
    IDLE,
    BUILDING
}
