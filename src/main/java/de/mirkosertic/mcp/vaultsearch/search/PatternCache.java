package de.mirkosertic.mcp.vaultsearch.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;

/**
 * Compiled regular expressions, keyed by their source.
 * <p>
 * Patterns use RE2 syntax and match in time linear to the input.
 */
public class PatternCache {

    static final int DEFAULT_MAX_SIZE = 1000;

    private final Cache<String, Pattern> cache;

    public PatternCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public PatternCache(final long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    public Pattern compile(final String regex) throws InvalidSearchCriteriaException {
        try {
            return cache.get(regex, Pattern::compile);
        } catch (final PatternSyntaxException e) {
            throw new InvalidSearchCriteriaException("Invalid regular expression for 'regexp'", e);
        }
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
