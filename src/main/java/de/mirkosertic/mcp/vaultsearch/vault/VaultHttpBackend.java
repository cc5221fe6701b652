package de.mirkosertic.mcp.vaultsearch.vault;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.mcp.vaultsearch.extract.SecretValue;
import de.mirkosertic.mcp.vaultsearch.extract.SecretValues;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SecretBackend} for a KV version 2 secrets engine, spoken to over Vault's HTTP API.
 * <p>
 * Listing uses {@code GET /v1/<mount>/metadata/<path>?list=true}, reading uses
 * {@code GET /v1/<mount>/data/<path>}. A 404 means an empty collection or a missing secret.
 */
public class VaultHttpBackend implements SecretBackend {

    private static final Logger logger = LoggerFactory.getLogger(VaultHttpBackend.class);

    static final String TOKEN_HEADER = "X-Vault-Token";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration READ_TIMEOUT = Duration.ofSeconds(30);

    private final RestTemplate restTemplate;
    private final String address;
    private final String token;
    private final String mountPoint;

    public VaultHttpBackend(final RestTemplate restTemplate,
                            final String address,
                            final String token,
                            final String mountPoint) {
        this.restTemplate = restTemplate;
        this.address = stripTrailingSlashes(address);
        this.token = token;
        this.mountPoint = stripSlashes(mountPoint);
    }

    public static VaultHttpBackend create(final String address, final String token, final String mountPoint) {
        final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(READ_TIMEOUT);
        return new VaultHttpBackend(new RestTemplate(requestFactory), address, token, mountPoint);
    }

    @Override
    public List<String> list(final String path) throws IOException {
        final String collection = stripSlashes(path);
        final URI uri = UriComponentsBuilder.fromUriString(address)
                .path("/v1/" + mountPoint + "/metadata/" + (collection.isEmpty() ? "" : collection + "/"))
                .queryParam("list", "true")
                .build()
                .encode()
                .toUri();

        final JsonNode body = get(uri, "list", path);
        if (body == null) {
            return List.of();
        }
        final JsonNode keys = body.path("data").path("keys");
        if (!keys.isArray()) {
            return List.of();
        }
        final List<String> children = new ArrayList<>(keys.size());
        for (final JsonNode key : keys) {
            children.add(key.asText());
        }
        return children;
    }

    @Override
    public @Nullable SecretValue read(final String path) throws IOException {
        final URI uri = UriComponentsBuilder.fromUriString(address)
                .path("/v1/" + mountPoint + "/data/" + stripSlashes(path))
                .build()
                .encode()
                .toUri();

        final JsonNode body = get(uri, "read", path);
        if (body == null) {
            return null;
        }
        final JsonNode data = body.path("data").path("data");
        if (data.isMissingNode() || data.isNull()) {
            return null;
        }
        return SecretValues.fromJson(data);
    }

    private @Nullable JsonNode get(final URI uri, final String operation, final String path) throws IOException {
        final HttpHeaders headers = new HttpHeaders();
        headers.set(TOKEN_HEADER, token);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        final HttpEntity<Void> entity = new HttpEntity<>(headers);

        try {
            final ResponseEntity<JsonNode> response = restTemplate.exchange(uri, HttpMethod.GET, entity, JsonNode.class);
            return response.getBody();
        } catch (final HttpStatusCodeException e) {
            final int status = e.getStatusCode().value();
            if (status == HttpStatus.NOT_FOUND.value()) {
                logger.debug("Nothing to {} at '{}'", operation, path);
                return null;
            }
            if (status == HttpStatus.FORBIDDEN.value()) {
                throw new PermissionDeniedException("permission denied to " + operation + " '" + path + "'", e);
            }
            throw new VaultAccessException(
                    "Vault answered " + status + " to " + operation + " '" + path + "'", status, e);
        } catch (final RestClientException e) {
            throw new VaultAccessException(
                    "Failed to " + operation + " '" + path + "': " + e.getMessage(), VaultAccessException.NO_STATUS, e);
        }
    }

    private static String stripSlashes(final String value) {
        String result = value;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        return stripTrailingSlashes(result);
    }

    private static String stripTrailingSlashes(final String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
