package de.mirkosertic.mcp.vaultsearch.search;

import org.jspecify.annotations.Nullable;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * @return the direction for {@code "asc"} or {@code "desc"}, {@code null} for a missing or blank value
     */
    public static @Nullable SortDirection parse(@Nullable final String value) throws InvalidSearchCriteriaException {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim()) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> throw new InvalidSearchCriteriaException("'sort' must be 'asc' or 'desc'");
        };
    }
}
