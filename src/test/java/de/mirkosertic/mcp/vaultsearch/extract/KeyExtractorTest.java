package de.mirkosertic.mcp.vaultsearch.extract;

import de.mirkosertic.mcp.vaultsearch.index.SecretRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("KeyExtractor Tests")
class KeyExtractorTest {

    private final KeyExtractor extractor = new KeyExtractor();

    @Test
    @DisplayName("Should return every top-level key in payload order")
    void shouldReturnTopLevelKeys() {
        // Given
        final SecretValue.MapValue data = map(
                "username", text("admin"),
                "password", text("s3cret"),
                "port", new SecretValue.Numeric(5432),
                "enabled", new SecretValue.Bool(true),
                "comment", SecretValue.Null.INSTANCE);

        // When
        final List<String> keys = extractor.extractKeys(data);

        // Then
        assertThat(keys).containsExactly("username", "password", "port", "enabled", "comment");
    }

    @Test
    @DisplayName("Should collect keys of nested maps and of maps inside lists")
    void shouldCollectNestedKeys() {
        final SecretValue.MapValue data = map(
                "database", map("host", text("db"), "credentials", map("user", text("u"))),
                "replicas", new SecretValue.ListValue(List.of(
                        map("replicaHost", text("r1")),
                        text("plain"),
                        new SecretValue.Numeric(3))));

        final List<String> keys = extractor.extractKeys(data);

        assertThat(keys).containsExactly("database", "host", "credentials", "user", "replicas", "replicaHost");
    }

    @Test
    @DisplayName("Should extract keys from a JSON document stored as a value")
    void shouldExtractKeysFromEmbeddedJson() {
        final SecretValue.MapValue data = map("cfg", text("{\"host\":\"x\"}"));

        final List<String> keys = extractor.extractKeys(data);

        assertThat(keys).containsExactly("cfg", "host");
    }

    @Test
    @DisplayName("Should take only map elements from an embedded JSON array")
    void shouldExtractKeysFromEmbeddedJsonArray() {
        final SecretValue.MapValue data = map("users", text("  [{\"name\":\"a\"}, \"loose\", 42, {\"role\":\"r\"}]"));

        final List<String> keys = extractor.extractKeys(data);

        assertThat(keys).containsExactly("users", "name", "role");
    }

    @Test
    @DisplayName("Should extract keys from a YAML document stored as a value")
    void shouldExtractKeysFromEmbeddedYaml() {
        final SecretValue.MapValue data = map("config", text("""
                server:
                  port: 8080
                  tls:
                    cert: abc
                """));

        final List<String> keys = extractor.extractKeys(data);

        assertThat(keys).containsExactly("config", "server", "port", "tls", "cert");
    }

    @Test
    @DisplayName("Should absorb malformed embedded documents without adding keys")
    void shouldAbsorbMalformedDocuments() {
        final SecretValue.MapValue data = map(
                "broken_json", text("{not json"),
                "broken_yaml", text("a: b\n- c"),
                "colon_only", text("http://example.com"));

        assertThatCode(() -> extractor.extractKeys(data)).doesNotThrowAnyException();
        assertThat(extractor.extractKeys(data)).containsExactly("broken_json", "broken_yaml", "colon_only");
    }

    @Test
    @DisplayName("Should stop silently at the depth cap")
    void shouldStopAtDepthCap() {
        // Given: k0 -> k1 -> ... -> k14 -> "leaf"
        SecretValue value = text("leaf");
        for (int i = 14; i >= 1; i--) {
            value = map("k" + i, value);
        }
        final SecretValue.MapValue data = map("k0", value);

        // When
        final List<String> keys = extractor.extractKeys(data);

        // Then: keys up to the cap only
        assertThat(keys).hasSize(KeyExtractor.DEFAULT_MAX_DEPTH + 1);
        assertThat(keys).contains("k0", "k5", "k10").doesNotContain("k11", "k14");
    }

    @Test
    @DisplayName("Should apply the depth cap to embedded documents as well")
    void shouldApplyDepthCapToEmbeddedDocuments() {
        final KeyExtractor shallow = new KeyExtractor(2);
        final SecretValue.MapValue data = map("outer", text("{\"a\":{\"b\":{\"c\":1}}}"));

        final List<String> keys = shallow.extractKeys(data);

        assertThat(keys).containsExactly("outer", "a", "b");
    }

    @Test
    @DisplayName("Should keep duplicate key names")
    void shouldKeepDuplicates() {
        final SecretValue.MapValue data = map(
                "primary", map("password", text("a")),
                "secondary", map("password", text("b")));

        assertThat(extractor.extractKeys(data)).containsExactly("primary", "password", "secondary", "password");
    }

    @Test
    @DisplayName("Should build a lowercase search string from path and keys")
    void shouldBuildSearchRecord() {
        final SecretValue.MapValue data = map("UserName", text("x"), "PassWord", text("y"));

        final SecretRecord record = extractor.extract("Prod/DB/Credentials", data);

        assertThat(record.allKeys()).containsExactly("UserName", "PassWord");
        assertThat(record.searchString()).isEqualTo("prod/db/credentials username password");
    }

    @Test
    @DisplayName("Should never put secret values into the search string")
    void shouldNotLeakValues() {
        final SecretValue.MapValue data = map("token", text("topsecretvalue"), "nested", text("{\"k\":\"alsosecret\"}"));

        final SecretRecord record = extractor.extract("app", data);

        assertThat(record.searchString()).isEqualTo("app token nested k");
    }

    @Test
    @DisplayName("Should detect embedded document candidates")
    void shouldDetectCandidates() {
        assertThat(KeyExtractor.looksLikeJson("  {\"a\":1}")).isTrue();
        assertThat(KeyExtractor.looksLikeJson("\n[1,2]")).isTrue();
        assertThat(KeyExtractor.looksLikeJson("plain")).isFalse();
        assertThat(KeyExtractor.looksLikeYaml("a: b\nc: d")).isTrue();
        assertThat(KeyExtractor.looksLikeYaml("a: b")).isFalse();
        assertThat(KeyExtractor.looksLikeYaml("line1\nline2")).isFalse();
    }

    private static SecretValue.Text text(final String value) {
        return new SecretValue.Text(value);
    }

    private static SecretValue.MapValue map(final Object... keyValuePairs) {
        final Map<String, SecretValue> entries = new LinkedHashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            entries.put((String) keyValuePairs[i], (SecretValue) keyValuePairs[i + 1]);
        }
        return new SecretValue.MapValue(entries);
    }
}
