package de.mirkosertic.mcp.vaultsearch.search;

import org.jspecify.annotations.Nullable;

/**
 * What to look for. Blank strings are treated as absent.
 *
 * @param term         case-insensitive substring of path and key names
 * @param regexPattern regular expression applied to the lowercase path and key names
 * @param pathSegment  one or more whole {@code /}-delimited segments the path must contain
 * @param sortDirection lexicographic order of the result, {@code null} for unspecified order
 * @param decorate     return UI links instead of bare paths
 */
public record SearchCriteria(
        @Nullable String term,
        @Nullable String regexPattern,
        @Nullable String pathSegment,
        @Nullable SortDirection sortDirection,
        boolean decorate
) {

    public SearchCriteria {
        term = blankToNull(term);
        regexPattern = blankToNull(regexPattern);
        pathSegment = blankToNull(pathSegment);
    }

    /**
     * Creates validated criteria.
     *
     * @throws InvalidSearchCriteriaException if no criterion is given, or both term and pattern are given
     */
    public static SearchCriteria of(@Nullable final String term,
                                    @Nullable final String regexPattern,
                                    @Nullable final String pathSegment,
                                    @Nullable final SortDirection sortDirection,
                                    final boolean decorate) throws InvalidSearchCriteriaException {
        final SearchCriteria criteria = new SearchCriteria(term, regexPattern, pathSegment, sortDirection, decorate);
        criteria.validate();
        return criteria;
    }

    public void validate() throws InvalidSearchCriteriaException {
        if (term == null && regexPattern == null && pathSegment == null) {
            throw new InvalidSearchCriteriaException(
                    "at least one of 'term', 'regexp', or 'in_path' parameters is required");
        }
        if (term != null && regexPattern != null) {
            throw new InvalidSearchCriteriaException("'term' and 'regexp' are mutually exclusive, use only one");
        }
    }

    public boolean hasContentCriterion() {
        return term != null || regexPattern != null;
    }

    public boolean hasPathCriterion() {
        return pathSegment != null;
    }

    private static @Nullable String blankToNull(@Nullable final String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
