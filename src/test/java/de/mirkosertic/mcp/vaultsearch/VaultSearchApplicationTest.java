package de.mirkosertic.mcp.vaultsearch;

import de.mirkosertic.mcp.vaultsearch.config.ApplicationConfig;
import de.mirkosertic.mcp.vaultsearch.crawler.EnumerationException;
import de.mirkosertic.mcp.vaultsearch.vault.InMemorySecretBackend;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static de.mirkosertic.mcp.vaultsearch.vault.InMemorySecretBackend.fields;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("VaultSearchApplication Tests")
class VaultSearchApplicationTest {

    private VaultSearchApplication app;

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.shutdown();
        }
    }

    @Test
    @DisplayName("Should build the index on startup and answer searches")
    void shouldBuildIndexOnStartup() throws Exception {
        // Given
        final InMemorySecretBackend backend = new InMemorySecretBackend()
                .put("prod/db/credentials", fields("username", "u", "password", "p"))
                .put("prod/api", fields("token", "t"));
        app = new VaultSearchApplication(config(true), backend);

        // When
        app.init();
        final McpSchema.CallToolResult result = app.getSearchTools().search(Map.of("term", "password"));

        // Then
        assertThat(app.getIndexCache().snapshot().size()).isEqualTo(2);
        assertThat(result.isError()).isFalse();
        assertThat(((McpSchema.TextContent) result.content().get(0)).text()).contains("prod/db/credentials");
    }

    @Test
    @DisplayName("Should leave the index empty when the startup build is disabled")
    void shouldSkipStartupBuild() throws Exception {
        final InMemorySecretBackend backend = new InMemorySecretBackend()
                .put("prod/api", fields("token", "t"));
        app = new VaultSearchApplication(config(false), backend);

        app.init();

        assertThat(app.getIndexCache().snapshot().isEmpty()).isTrue();
        assertThat(backend.getListCalls()).isZero();
    }

    @Test
    @DisplayName("Should fail startup when the secret tree cannot be listed")
    void shouldFailWhenListingFails() {
        final InMemorySecretBackend backend = new InMemorySecretBackend()
                .put("prod/api", fields("token", "t"))
                .failListingOf("");
        app = new VaultSearchApplication(config(true), backend);

        assertThatThrownBy(app::init).isInstanceOf(EnumerationException.class);
        assertThat(app.getIndexCache().isRebuilding()).isFalse();
    }

    private static ApplicationConfig config(final boolean rebuildOnStartup) {
        final ApplicationConfig config = mock(ApplicationConfig.class);
        when(config.getConcurrency()).thenReturn(2);
        when(config.getFetchConcurrency()).thenReturn(2);
        when(config.getPathQueueCapacity()).thenReturn(100);
        when(config.getMaxNestedDepth()).thenReturn(10);
        when(config.getSearchTimeoutMs()).thenReturn(5000L);
        when(config.getUiBaseUrl()).thenReturn("http://vault:8200/ui/vault/secrets/kv/show");
        when(config.getVaultAddress()).thenReturn("http://vault:8200");
        when(config.getMountPoint()).thenReturn("kv");
        when(config.isRebuildOnStartup()).thenReturn(rebuildOnStartup);
        return config;
    }
}
