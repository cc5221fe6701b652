package de.mirkosertic.mcp.vaultsearch.search;

import com.google.re2j.Pattern;
import de.mirkosertic.mcp.vaultsearch.index.IndexSnapshot;
import de.mirkosertic.mcp.vaultsearch.index.SecretIndexCache;
import de.mirkosertic.mcp.vaultsearch.index.SecretRecord;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates {@link SearchCriteria} against the currently published index snapshot.
 * <p>
 * Content and path criteria are scanned in parallel over the same snapshot. Both scans
 * share one deadline; when it passes, both are interrupted and the search fails with
 * {@link SearchTimeoutException}.
 */
public class SecretSearchService {

    private static final Logger logger = LoggerFactory.getLogger(SecretSearchService.class);

    private final SecretIndexCache cache;
    private final PatternCache patternCache;
    private final String uiBaseUrl;
    private final ExecutorService scanExecutor;

    public SecretSearchService(final SecretIndexCache cache,
                               final PatternCache patternCache,
                               final String uiBaseUrl,
                               final int scanThreads) {
        this.cache = cache;
        this.patternCache = patternCache;
        this.uiBaseUrl = uiBaseUrl;

        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "search-scan-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        this.scanExecutor = new ThreadPoolExecutor(
                scanThreads, scanThreads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory);
    }

    public SearchResult search(final SearchCriteria criteria, final Duration timeout) throws SearchException {
        criteria.validate();
        final long startTime = System.currentTimeMillis();
        final long deadline = System.nanoTime() + timeout.toNanos();

        final Pattern pattern = criteria.regexPattern() != null ? patternCache.compile(criteria.regexPattern()) : null;
        final String term = criteria.term() != null ? criteria.term().toLowerCase(Locale.ROOT) : null;
        final String pathSegment = criteria.pathSegment();

        // One snapshot for the whole search
        final IndexSnapshot snapshot = cache.snapshot();

        final Future<List<String>> contentFuture = criteria.hasContentCriterion()
                ? scanExecutor.submit(contentScan(snapshot, term, pattern))
                : null;
        final Future<List<String>> pathFuture = pathSegment != null
                ? scanExecutor.submit(pathScan(snapshot, pathSegment))
                : null;

        final List<String> contentMatches;
        final List<String> pathMatches;
        try {
            contentMatches = await(contentFuture, deadline);
            pathMatches = await(pathFuture, deadline);
        } catch (final TimeoutException e) {
            cancel(contentFuture, pathFuture);
            logger.error("Search timeout exceeded for term={}, regexp={}, in_path={}",
                    criteria.term(), criteria.regexPattern(), pathSegment);
            throw new SearchTimeoutException(timeout);
        } catch (final InterruptedException e) {
            cancel(contentFuture, pathFuture);
            Thread.currentThread().interrupt();
            throw new SearchException("Search interrupted", e);
        } catch (final ExecutionException e) {
            cancel(contentFuture, pathFuture);
            logger.error("Error during search", e.getCause());
            throw new SearchException("Error during search", e.getCause());
        }

        List<String> matches = combine(contentMatches, pathMatches);
        matches = sort(matches, criteria.sortDirection());
        if (criteria.decorate()) {
            matches = decorate(matches);
        }

        final long searchTimeMs = System.currentTimeMillis() - startTime;
        logger.debug("Search over {} secrets found {} matches in {}ms", snapshot.size(), matches.size(), searchTimeMs);
        return new SearchResult(matches, uiBaseUrl, searchTimeMs);
    }

    public String getUiBaseUrl() {
        return uiBaseUrl;
    }

    private static Callable<List<String>> contentScan(final IndexSnapshot snapshot,
                                                      @Nullable final String term,
                                                      @Nullable final Pattern pattern) {
        return () -> {
            final List<String> result = new ArrayList<>();
            for (final Map.Entry<String, SecretRecord> entry : snapshot.records().entrySet()) {
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                final String searchString = entry.getValue().searchString();
                final boolean hit = term != null
                        ? searchString.contains(term)
                        : pattern != null && pattern.matcher(searchString).find();
                if (hit) {
                    result.add(entry.getKey());
                }
            }
            return result;
        };
    }

    private static Callable<List<String>> pathScan(final IndexSnapshot snapshot, final String pathSegment) {
        return () -> {
            final List<String> result = new ArrayList<>();
            for (final String path : snapshot.records().keySet()) {
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                if (PathSegmentMatcher.matches(path, pathSegment)) {
                    result.add(path);
                }
            }
            return result;
        };
    }

    private static @Nullable List<String> await(@Nullable final Future<List<String>> scan, final long deadline)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (scan == null) {
            return null;
        }
        final long remaining = deadline - System.nanoTime();
        if (remaining <= 0 && !scan.isDone()) {
            throw new TimeoutException();
        }
        return scan.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
    }

    private static void cancel(@Nullable final Future<?> first, @Nullable final Future<?> second) {
        if (first != null) {
            first.cancel(true);
        }
        if (second != null) {
            second.cancel(true);
        }
    }

    static List<String> combine(@Nullable final List<String> contentMatches, @Nullable final List<String> pathMatches) {
        if (contentMatches != null && pathMatches != null) {
            final Set<String> pathSet = new HashSet<>(pathMatches);
            final List<String> intersection = new ArrayList<>();
            for (final String path : contentMatches) {
                if (pathSet.contains(path)) {
                    intersection.add(path);
                }
            }
            return intersection;
        }
        if (contentMatches != null) {
            return contentMatches;
        }
        return pathMatches != null ? pathMatches : List.of();
    }

    static List<String> sort(final List<String> matches, @Nullable final SortDirection direction) {
        if (direction == null) {
            return matches;
        }
        final List<String> sorted = new ArrayList<>(matches);
        Collections.sort(sorted);
        if (direction == SortDirection.DESC) {
            Collections.reverse(sorted);
        }
        return sorted;
    }

    private List<String> decorate(final List<String> matches) {
        final List<String> links = new ArrayList<>(matches.size());
        for (final String path : matches) {
            links.add(uiBaseUrl + "/" + path);
        }
        return links;
    }

    public void shutdown() {
        logger.info("Shutting down SecretSearchService");
        scanExecutor.shutdownNow();
    }
}
