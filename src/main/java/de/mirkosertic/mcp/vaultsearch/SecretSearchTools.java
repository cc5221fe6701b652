package de.mirkosertic.mcp.vaultsearch;

import de.mirkosertic.mcp.vaultsearch.config.BuildInfo;
import de.mirkosertic.mcp.vaultsearch.index.IndexRebuildService;
import de.mirkosertic.mcp.vaultsearch.index.IndexStatus;
import de.mirkosertic.mcp.vaultsearch.index.RebuildOutcome;
import de.mirkosertic.mcp.vaultsearch.index.SecretIndexCache;
import de.mirkosertic.mcp.vaultsearch.mcp.SchemaGenerator;
import de.mirkosertic.mcp.vaultsearch.mcp.ToolResultHelper;
import de.mirkosertic.mcp.vaultsearch.mcp.dto.ErrorType;
import de.mirkosertic.mcp.vaultsearch.mcp.dto.IndexStatusResponse;
import de.mirkosertic.mcp.vaultsearch.mcp.dto.RebuildIndexResponse;
import de.mirkosertic.mcp.vaultsearch.mcp.dto.SearchRequest;
import de.mirkosertic.mcp.vaultsearch.mcp.dto.SearchResponse;
import de.mirkosertic.mcp.vaultsearch.search.InvalidSearchCriteriaException;
import de.mirkosertic.mcp.vaultsearch.search.SearchCriteria;
import de.mirkosertic.mcp.vaultsearch.search.SearchException;
import de.mirkosertic.mcp.vaultsearch.search.SearchResult;
import de.mirkosertic.mcp.vaultsearch.search.SearchTimeoutException;
import de.mirkosertic.mcp.vaultsearch.search.SecretSearchService;
import de.mirkosertic.mcp.vaultsearch.search.SortDirection;
import de.mirkosertic.mcp.vaultsearch.util.HumanReadable;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MCP tools for searching the Vault secret index and managing its rebuilds.
 */
public class SecretSearchTools {

    private static final Logger logger = LoggerFactory.getLogger(SecretSearchTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Search Vault secrets by key name, path text or path segment. Secret VALUES are never indexed or returned. \
            Provide at least one of: \
            - 'term': case-insensitive substring of the secret path or any key name, including keys of nested \
            maps and of JSON/YAML documents stored as values \
            - 'regexp': regular expression matched against the lowercase path and key names \
            - 'inPath': whole path segment(s), e.g. 'prod' matches 'prod/db' and 'staging/prod' but not 'production' \
            'term' and 'regexp' are mutually exclusive. Combining a content criterion with 'inPath' returns the intersection. \
            Results reflect the last completed index build; use getIndexStatus to see its age.""";

    private final SecretSearchService searchService;
    private final SecretIndexCache indexCache;
    private final IndexRebuildService rebuildService;
    private final Duration searchTimeout;

    public SecretSearchTools(final SecretSearchService searchService,
                             final SecretIndexCache indexCache,
                             final IndexRebuildService rebuildService,
                             final Duration searchTimeout) {
        this.searchService = searchService;
        this.indexCache = indexCache;
        this.rebuildService = rebuildService;
        this.searchTimeout = searchTimeout;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("search")
                        .description(SEARCH_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(SearchRequest.class))
                        .build())
                .callHandler((exchange, request) -> search(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getIndexStatus")
                        .description("Get the state of the secret index: whether a rebuild is running, its progress, "
                                + "build duration, cache age, approximate memory footprint and the last rebuild error.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getIndexStatus())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("rebuildIndex")
                        .description("Start rebuilding the secret index from Vault in the background. "
                                + "Searches keep using the previous index until the rebuild completes. "
                                + "Returns 'already_in_progress' if a rebuild is running.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> rebuildIndex())
                .build());

        return tools;
    }

    McpSchema.CallToolResult search(final Map<String, Object> args) {
        final SearchRequest request = SearchRequest.fromMap(args);

        logger.info("Search request: term='{}', regexp='{}', inPath='{}', sort={}, showUi={}",
                request.term(), request.regexp(), request.inPath(), request.sort(), request.showUi());

        try {
            final SearchCriteria criteria = SearchCriteria.of(
                    request.term(),
                    request.regexp(),
                    request.inPath(),
                    SortDirection.parse(request.sort()),
                    request.effectiveShowUi());

            final SearchResult result = searchService.search(criteria, searchTimeout);

            logger.info("Search completed in {}ms: {} matches", result.searchTimeMs(), result.matches().size());
            return ToolResultHelper.createResult(SearchResponse.success(result.matches(), result.searchTimeMs()));

        } catch (final InvalidSearchCriteriaException e) {
            logger.warn("Invalid search request: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchResponse.error(ErrorType.BAD_REQUEST, e.getMessage()));
        } catch (final SearchTimeoutException e) {
            return ToolResultHelper.createResult(SearchResponse.error(ErrorType.TIMEOUT, e.getMessage()));
        } catch (final SearchException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchResponse.error(ErrorType.INTERNAL, "Error during search"));
        }
    }

    McpSchema.CallToolResult getIndexStatus() {
        try {
            final IndexStatus status = indexCache.status();
            logger.info("Status requested");
            return ToolResultHelper.createResult(new IndexStatusResponse(
                    true,
                    BuildInfo.getVersion(),
                    status.rebuilding(),
                    HumanReadable.duration(status.buildDuration()),
                    HumanReadable.duration(status.cacheAge()),
                    status.approxSizeBytes(),
                    HumanReadable.bytes(status.approxSizeBytes()),
                    status.indexedSecrets(),
                    status.fetched(),
                    status.total(),
                    status.totalKeysIndexed(),
                    status.progressPercent(),
                    status.lastCompletedBuild() != null ? status.lastCompletedBuild().toString() : null,
                    status.lastRebuildError(),
                    null));
        } catch (final RuntimeException e) {
            logger.error("Error getting index status", e);
            return ToolResultHelper.createResult(IndexStatusResponse.error("Error getting index status: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult rebuildIndex() {
        logger.info("Index rebuild requested");
        try {
            final RebuildOutcome outcome = rebuildService.triggerRebuild();
            return ToolResultHelper.createResult(outcome == RebuildOutcome.ACCEPTED
                    ? RebuildIndexResponse.accepted()
                    : RebuildIndexResponse.alreadyInProgress());
        } catch (final RuntimeException e) {
            logger.error("Error starting index rebuild", e);
            return ToolResultHelper.createResult(RebuildIndexResponse.error("Error starting index rebuild: " + e.getMessage()));
        }
    }
}
