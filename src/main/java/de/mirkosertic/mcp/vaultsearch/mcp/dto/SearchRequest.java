package de.mirkosertic.mcp.vaultsearch.mcp.dto;

import de.mirkosertic.mcp.vaultsearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the search tool.
 */
public record SearchRequest(
        @Nullable
        @Description("Case-insensitive substring matched against secret paths and key names. Mutually exclusive with 'regexp'.")
        String term,

        @Nullable
        @Description("Regular expression (RE2 syntax, no backreferences or lookaround) matched against the lowercase secret path and key names. Mutually exclusive with 'term'.")
        String regexp,

        @Nullable
        @Description("Whole path segment(s) the secret path must contain, e.g. 'prod' or 'prod/db'. 'prod' does not match 'production'.")
        String inPath,

        @Nullable
        @Description("Sort the matching paths lexicographically: 'asc' or 'desc'. Unsorted if omitted.")
        String sort,

        @Nullable
        @Description("Return links into the Vault web UI instead of bare secret paths. Default is false.")
        Boolean showUi
) {

    public static SearchRequest fromMap(final Map<String, Object> args) {
        return new SearchRequest(
                stringArg(args, "term"),
                stringArg(args, "regexp"),
                stringArg(args, "inPath"),
                stringArg(args, "sort"),
                booleanArg(args, "showUi")
        );
    }

    public boolean effectiveShowUi() {
        return showUi != null && showUi;
    }

    private static @Nullable String stringArg(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        return value != null ? value.toString() : null;
    }

    private static @Nullable Boolean booleanArg(final Map<String, Object> args, final String name) {
        final Object value = args.get(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null ? Boolean.valueOf(value.toString().trim()) : null;
    }
}
