package de.mirkosertic.mcp.vaultsearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the Vault search server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.vaultsearch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_VAULT_ADDR = "VAULT_ADDR";
    private static final String ENV_VAULT_TOKEN = "VAULT_TOKEN";
    private static final String ENV_VAULT_MOUNT_POINT = "VAULT_MOUNT_POINT";
    private static final String ENV_CONCURRENCY = "VAULT_SEARCH_CONCURRENCY";
    private static final String ENV_FETCH_CONCURRENCY = "VAULT_SEARCH_FETCH_CONCURRENCY";
    private static final String ENV_SEARCH_TIMEOUT_MS = "VAULT_SEARCH_TIMEOUT_MS";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".vaultsearch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    static final int DEFAULT_CONCURRENCY = 15;
    static final int FALLBACK_CONCURRENCY = 10;

    // Vault settings
    private String vaultAddress = "http://127.0.0.1:8200";
    private String vaultToken = "";
    private String mountPoint = "kv";

    // Index settings
    private int concurrency = DEFAULT_CONCURRENCY;
    private int fetchConcurrency = DEFAULT_CONCURRENCY;
    private int maxNestedDepth = 10;
    private int pathQueueCapacity = 1000;
    private boolean rebuildOnStartup = true;

    // Search settings
    private long searchTimeoutMs = 5000;
    private String uiBasePath = "{address}/ui/vault/secrets/{mount}/show";

    // Profile settings
    private boolean deployedMode = false;

    ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: vaultAddress={}, mountPoint={}, concurrency={}, fetchConcurrency={}, deployedMode={}",
                config.vaultAddress, config.mountPoint, config.concurrency, config.fetchConcurrency, config.deployedMode);

        if (config.vaultToken.isEmpty()) {
            logger.warn("No Vault token configured, requests will most likely be denied");
        }

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> rootConfig = (Map<String, Object>) config.get("vaultsearch");
        if (rootConfig == null) {
            return;
        }

        final Map<String, Object> vaultConfig = (Map<String, Object>) rootConfig.get("vault");
        if (vaultConfig != null) {
            applyVaultConfig(vaultConfig);
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) rootConfig.get("index");
        if (indexConfig != null) {
            applyIndexConfig(indexConfig);
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) rootConfig.get("search");
        if (searchConfig != null) {
            applySearchConfig(searchConfig);
        }
    }

    private void applyVaultConfig(final Map<String, Object> vaultConfig) {
        if (vaultConfig.get("address") != null) {
            this.vaultAddress = resolveVariables(vaultConfig.get("address").toString());
        }
        if (vaultConfig.get("token") != null) {
            this.vaultToken = resolveVariables(vaultConfig.get("token").toString());
        }
        if (vaultConfig.get("mount-point") != null) {
            this.mountPoint = resolveVariables(vaultConfig.get("mount-point").toString());
        }
    }

    private void applyIndexConfig(final Map<String, Object> indexConfig) {
        if (indexConfig.get("concurrency") != null) {
            this.concurrency = parseConcurrency(String.valueOf(indexConfig.get("concurrency")), "concurrency");
        }
        if (indexConfig.get("fetch-concurrency") != null) {
            this.fetchConcurrency = parseConcurrency(String.valueOf(indexConfig.get("fetch-concurrency")), "fetch-concurrency");
        }
        if (indexConfig.get("max-nested-depth") != null) {
            this.maxNestedDepth = (int) parsePositive(indexConfig.get("max-nested-depth"), "max-nested-depth", maxNestedDepth);
        }
        if (indexConfig.get("path-queue-capacity") != null) {
            this.pathQueueCapacity = (int) parsePositive(indexConfig.get("path-queue-capacity"), "path-queue-capacity", pathQueueCapacity);
        }
        if (indexConfig.get("rebuild-on-startup") != null) {
            this.rebuildOnStartup = Boolean.parseBoolean(String.valueOf(indexConfig.get("rebuild-on-startup")).trim());
        }
    }

    private void applySearchConfig(final Map<String, Object> searchConfig) {
        if (searchConfig.get("timeout-ms") != null) {
            this.searchTimeoutMs = parsePositive(searchConfig.get("timeout-ms"), "timeout-ms", searchTimeoutMs);
        }
        if (searchConfig.get("ui-base-path") != null) {
            this.uiBasePath = searchConfig.get("ui-base-path").toString();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envAddress = System.getenv(ENV_VAULT_ADDR);
        if (envAddress != null && !envAddress.trim().isEmpty()) {
            this.vaultAddress = envAddress.trim();
        }

        final String envToken = System.getenv(ENV_VAULT_TOKEN);
        if (envToken != null && !envToken.trim().isEmpty()) {
            this.vaultToken = envToken.trim();
        }

        final String envMount = System.getenv(ENV_VAULT_MOUNT_POINT);
        if (envMount != null && !envMount.trim().isEmpty()) {
            this.mountPoint = envMount.trim();
            logger.info("Vault mount point from environment: {}", this.mountPoint);
        }

        final String envConcurrency = System.getenv(ENV_CONCURRENCY);
        if (envConcurrency != null && !envConcurrency.trim().isEmpty()) {
            this.concurrency = parseConcurrency(envConcurrency, ENV_CONCURRENCY);
        }

        final String envFetchConcurrency = System.getenv(ENV_FETCH_CONCURRENCY);
        if (envFetchConcurrency != null && !envFetchConcurrency.trim().isEmpty()) {
            this.fetchConcurrency = parseConcurrency(envFetchConcurrency, ENV_FETCH_CONCURRENCY);
        }

        final String envTimeout = System.getenv(ENV_SEARCH_TIMEOUT_MS);
        if (envTimeout != null && !envTimeout.trim().isEmpty()) {
            this.searchTimeoutMs = parsePositive(envTimeout, ENV_SEARCH_TIMEOUT_MS, searchTimeoutMs);
        }

        // System properties sit below environment variables
        final String propAddress = System.getProperty("vault.address");
        if (propAddress != null && !propAddress.isEmpty() && (envAddress == null || envAddress.isBlank())) {
            this.vaultAddress = propAddress;
        }
        final String propMount = System.getProperty("vault.mount-point");
        if (propMount != null && !propMount.isEmpty() && (envMount == null || envMount.isBlank())) {
            this.mountPoint = propMount;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    static int parseConcurrency(final String value, final String source) {
        try {
            return validConcurrency(Integer.parseInt(value.trim()), source);
        } catch (final NumberFormatException e) {
            logger.warn("Invalid {} '{}', falling back to {}", source, value, FALLBACK_CONCURRENCY);
            return FALLBACK_CONCURRENCY;
        }
    }

    /**
     * Parses a positive whole number from a YAML value or environment string.
     * Anything else keeps {@code fallback}.
     */
    static long parsePositive(final Object value, final String source, final long fallback) {
        final long parsed;
        if (value instanceof Integer || value instanceof Long) {
            parsed = ((Number) value).longValue();
        } else {
            try {
                parsed = Long.parseLong(String.valueOf(value).trim());
            } catch (final NumberFormatException e) {
                logger.warn("Invalid {} '{}', keeping {}", source, value, fallback);
                return fallback;
            }
        }
        if (parsed <= 0 || parsed > Integer.MAX_VALUE) {
            logger.warn("Invalid {} {}, keeping {}", source, parsed, fallback);
            return fallback;
        }
        return parsed;
    }

    private static int validConcurrency(final int value, final String source) {
        if (value <= 0) {
            logger.warn("Invalid {} {}, falling back to {}", source, value, FALLBACK_CONCURRENCY);
            return FALLBACK_CONCURRENCY;
        }
        return value;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Base URL of the Vault web UI for secrets of the configured mount,
     * built from the {@code {address}} and {@code {mount}} placeholders of the template.
     */
    public String getUiBaseUrl() {
        final String address = vaultAddress.endsWith("/")
                ? vaultAddress.substring(0, vaultAddress.length() - 1)
                : vaultAddress;
        return uiBasePath
                .replace("{address}", address)
                .replace("{mount}", mountPoint);
    }

    // Getters
    public String getVaultAddress() {
        return vaultAddress;
    }

    public String getVaultToken() {
        return vaultToken;
    }

    public String getMountPoint() {
        return mountPoint;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getFetchConcurrency() {
        return fetchConcurrency;
    }

    public int getMaxNestedDepth() {
        return maxNestedDepth;
    }

    public int getPathQueueCapacity() {
        return pathQueueCapacity;
    }

    public boolean isRebuildOnStartup() {
        return rebuildOnStartup;
    }

    public long getSearchTimeoutMs() {
        return searchTimeoutMs;
    }

    public String getUiBasePath() {
        return uiBasePath;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
