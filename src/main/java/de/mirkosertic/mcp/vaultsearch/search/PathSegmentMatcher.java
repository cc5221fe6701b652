package de.mirkosertic.mcp.vaultsearch.search;

/**
 * Matches secret paths against whole {@code /}-delimited segments.
 * <p>
 * {@code "prod"} matches {@code prod/db} and {@code staging/prod}, but neither
 * {@code production/db} nor {@code game-products/x}. A needle may span several
 * segments, e.g. {@code "prod/db"}.
 */
public final class PathSegmentMatcher {

    private static final char SEPARATOR = '/';

    private PathSegmentMatcher() {
    }

    public static boolean matches(final String path, final String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        if (path.equals(segment)) {
            return true;
        }
        int index = path.indexOf(segment);
        while (index >= 0) {
            final int end = index + segment.length();
            final boolean startAligned = index == 0 || path.charAt(index - 1) == SEPARATOR;
            final boolean endAligned = end == path.length() || path.charAt(end) == SEPARATOR;
            if (startAligned && endAligned) {
                return true;
            }
            index = path.indexOf(segment, index + 1);
        }
        return false;
    }
}
