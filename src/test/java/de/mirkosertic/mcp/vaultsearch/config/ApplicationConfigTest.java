package de.mirkosertic.mcp.vaultsearch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @Test
    @DisplayName("Should use built-in defaults")
    void shouldUseDefaults() {
        final ApplicationConfig config = new ApplicationConfig();

        assertThat(config.getMountPoint()).isEqualTo("kv");
        assertThat(config.getConcurrency()).isEqualTo(ApplicationConfig.DEFAULT_CONCURRENCY);
        assertThat(config.getFetchConcurrency()).isEqualTo(ApplicationConfig.DEFAULT_CONCURRENCY);
        assertThat(config.getMaxNestedDepth()).isEqualTo(10);
        assertThat(config.getSearchTimeoutMs()).isEqualTo(5000);
        assertThat(config.isRebuildOnStartup()).isTrue();
    }

    @Test
    @DisplayName("Should apply YAML sections")
    void shouldApplyYaml() {
        final ApplicationConfig config = new ApplicationConfig();

        config.applyYamlConfig(Map.of("vaultsearch", Map.of(
                "vault", Map.of("address", "https://vault.example.com", "mount-point", "secret", "token", "s.abc"),
                "index", Map.of("concurrency", 4, "fetch-concurrency", 8, "max-nested-depth", 5,
                        "path-queue-capacity", 50, "rebuild-on-startup", false),
                "search", Map.of("timeout-ms", 2500, "ui-base-path", "{address}/custom/{mount}"))));

        assertThat(config.getVaultAddress()).isEqualTo("https://vault.example.com");
        assertThat(config.getMountPoint()).isEqualTo("secret");
        assertThat(config.getVaultToken()).isEqualTo("s.abc");
        assertThat(config.getConcurrency()).isEqualTo(4);
        assertThat(config.getFetchConcurrency()).isEqualTo(8);
        assertThat(config.getMaxNestedDepth()).isEqualTo(5);
        assertThat(config.getPathQueueCapacity()).isEqualTo(50);
        assertThat(config.isRebuildOnStartup()).isFalse();
        assertThat(config.getSearchTimeoutMs()).isEqualTo(2500);
        assertThat(config.getUiBaseUrl()).isEqualTo("https://vault.example.com/custom/secret");
    }

    @Test
    @DisplayName("Should fall back for invalid concurrency values")
    void shouldFallBackForInvalidConcurrency() {
        assertThat(ApplicationConfig.parseConcurrency("20", "test")).isEqualTo(20);
        assertThat(ApplicationConfig.parseConcurrency(" 7 ", "test")).isEqualTo(7);
        assertThat(ApplicationConfig.parseConcurrency("many", "test")).isEqualTo(ApplicationConfig.FALLBACK_CONCURRENCY);
        assertThat(ApplicationConfig.parseConcurrency("0", "test")).isEqualTo(ApplicationConfig.FALLBACK_CONCURRENCY);
        assertThat(ApplicationConfig.parseConcurrency("-3", "test")).isEqualTo(ApplicationConfig.FALLBACK_CONCURRENCY);
    }

    @Test
    @DisplayName("Should keep working values when YAML numbers are quoted, misspelled or out of range")
    void shouldTolerateInvalidYamlNumbers() {
        // Given
        final ApplicationConfig config = new ApplicationConfig();

        // When
        config.applyYamlConfig(Map.of("vaultsearch", Map.of(
                "index", Map.of("concurrency", "12", "fetch-concurrency", "ten", "max-nested-depth", -1,
                        "path-queue-capacity", "lots", "rebuild-on-startup", "false"),
                "search", Map.of("timeout-ms", -5))));

        // Then
        assertThat(config.getConcurrency()).isEqualTo(12);
        assertThat(config.getFetchConcurrency()).isEqualTo(ApplicationConfig.FALLBACK_CONCURRENCY);
        assertThat(config.getMaxNestedDepth()).isEqualTo(10);
        assertThat(config.getPathQueueCapacity()).isEqualTo(1000);
        assertThat(config.isRebuildOnStartup()).isFalse();
        assertThat(config.getSearchTimeoutMs()).isEqualTo(5000);
    }

    @Test
    @DisplayName("Should parse positive numbers and keep the fallback otherwise")
    void shouldParsePositiveNumbers() {
        assertThat(ApplicationConfig.parsePositive(250, "test", 1)).isEqualTo(250);
        assertThat(ApplicationConfig.parsePositive(" 42 ", "test", 1)).isEqualTo(42);
        assertThat(ApplicationConfig.parsePositive(0, "test", 7)).isEqualTo(7);
        assertThat(ApplicationConfig.parsePositive(2.5, "test", 7)).isEqualTo(7);
        assertThat(ApplicationConfig.parsePositive("soon", "test", 7)).isEqualTo(7);
    }

    @Test
    @DisplayName("Should build the UI base URL without a doubled slash")
    void shouldBuildUiBaseUrl() {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(Map.of("vaultsearch", Map.of(
                "vault", Map.of("address", "http://127.0.0.1:8200/", "mount-point", "kv"))));

        assertThat(config.getUiBaseUrl()).isEqualTo("http://127.0.0.1:8200/ui/vault/secrets/kv/show");
    }

    @Test
    @DisplayName("Should resolve variables with defaults")
    void shouldResolveVariables() {
        System.setProperty("vaultsearch.test.var", "resolved");
        try {
            assertThat(ApplicationConfig.resolveVariables("${vaultsearch.test.var}")).isEqualTo("resolved");
            assertThat(ApplicationConfig.resolveVariables("${VAULTSEARCH_UNSET_VARIABLE:fallback}")).isEqualTo("fallback");
            assertThat(ApplicationConfig.resolveVariables("plain")).isEqualTo("plain");
        } finally {
            System.clearProperty("vaultsearch.test.var");
        }
    }
}
