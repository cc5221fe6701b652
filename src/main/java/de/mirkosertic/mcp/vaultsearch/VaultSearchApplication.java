package de.mirkosertic.mcp.vaultsearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.vaultsearch.config.ApplicationConfig;
import de.mirkosertic.mcp.vaultsearch.config.BuildInfo;
import de.mirkosertic.mcp.vaultsearch.config.LoggingConfigurator;
import de.mirkosertic.mcp.vaultsearch.crawler.CrawlExecutorService;
import de.mirkosertic.mcp.vaultsearch.crawler.EnumerationException;
import de.mirkosertic.mcp.vaultsearch.crawler.SecretTreeEnumerator;
import de.mirkosertic.mcp.vaultsearch.extract.KeyExtractor;
import de.mirkosertic.mcp.vaultsearch.index.IndexRebuildService;
import de.mirkosertic.mcp.vaultsearch.index.SecretIndexCache;
import de.mirkosertic.mcp.vaultsearch.mcp.LatestProtocolStdioServerTransportProvider;
import de.mirkosertic.mcp.vaultsearch.search.PatternCache;
import de.mirkosertic.mcp.vaultsearch.search.SecretSearchService;
import de.mirkosertic.mcp.vaultsearch.vault.SecretBackend;
import de.mirkosertic.mcp.vaultsearch.vault.VaultHttpBackend;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Main entry point for the MCP Vault Search Server.
 * Builds the index on startup and serves searches over the MCP STDIO transport.
 */
public class VaultSearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(VaultSearchApplication.class);

    private static final int SEARCH_SCAN_THREADS = 4;

    private final ApplicationConfig config;
    private final CrawlExecutorService listingExecutor;
    private final CrawlExecutorService fetchExecutor;
    private final SecretIndexCache indexCache;
    private final IndexRebuildService rebuildService;
    private final SecretSearchService searchService;
    private final SecretSearchTools searchTools;
    private McpSyncServer mcpServer;

    public VaultSearchApplication(final ApplicationConfig config) {
        this(config, VaultHttpBackend.create(config.getVaultAddress(), config.getVaultToken(), config.getMountPoint()));
    }

    VaultSearchApplication(final ApplicationConfig config, final SecretBackend backend) {
        this.config = config;

        this.listingExecutor = new CrawlExecutorService("vault-list", config.getConcurrency());
        this.fetchExecutor = new CrawlExecutorService("vault-fetch", config.getFetchConcurrency());

        this.indexCache = new SecretIndexCache();

        final SecretTreeEnumerator enumerator = new SecretTreeEnumerator(
                backend,
                listingExecutor,
                config.getConcurrency(),
                config.getPathQueueCapacity());

        this.rebuildService = new IndexRebuildService(
                indexCache,
                enumerator,
                backend,
                new KeyExtractor(config.getMaxNestedDepth()),
                fetchExecutor,
                config.getFetchConcurrency());

        this.searchService = new SecretSearchService(
                indexCache,
                new PatternCache(),
                config.getUiBaseUrl(),
                SEARCH_SCAN_THREADS);

        this.searchTools = new SecretSearchTools(
                searchService,
                indexCache,
                rebuildService,
                Duration.ofMillis(config.getSearchTimeoutMs()));
    }

    /**
     * Builds the initial index unless disabled.
     *
     * @throws EnumerationException if the secret tree could not be listed
     */
    public void init() throws EnumerationException {
        logger.info("Initializing MCP Vault Search Server...");

        if (config.isRebuildOnStartup()) {
            logger.info("Building initial index of mount '{}' at {}", config.getMountPoint(), config.getVaultAddress());
            rebuildService.rebuildNow();
        } else {
            logger.info("Initial index build disabled, index stays empty until rebuildIndex is called");
        }

        logger.info("All services initialized successfully");
    }

    /**
     * Start the MCP server.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Vault Search Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final LatestProtocolStdioServerTransportProvider transportProvider =
                new LatestProtocolStdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(searchTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport handles all communication
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }

        logger.info("Main thread finished, shutting down...");
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down MCP Vault Search Server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            rebuildService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down rebuild service", e);
        }

        try {
            searchService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down search service", e);
        }

        try {
            listingExecutor.shutdown();
            fetchExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down crawl executors", e);
        }

        logger.info("MCP Vault Search Server shutdown complete");
    }

    SecretIndexCache getIndexCache() {
        return indexCache;
    }

    SecretSearchTools getSearchTools() {
        return searchTools;
    }

    public static void main(final String[] args) {
        final ApplicationConfig config;
        try {
            // Logging first, before anything logs
            final boolean deployedMode = "deployed".equals(System.getProperty("spring.profiles.active"));
            LoggingConfigurator.configure(deployedMode);

            config = ApplicationConfig.load();
            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
            }
        } catch (final Exception e) {
            System.err.println("Failed to start MCP Vault Search Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
            return;
        }

        final VaultSearchApplication app = new VaultSearchApplication(config);
        try {
            app.init();
        } catch (final EnumerationException e) {
            logger.error("Initial index build failed, Vault may be unreachable: {}", e.getMessage(), e);
            System.err.println("Initial index build failed, Vault may be unreachable: " + e.getMessage());
            app.shutdown();
            System.exit(1);
            return;
        }

        app.start();
        logger.info("MCP Vault Search Server finished.");
    }
}
