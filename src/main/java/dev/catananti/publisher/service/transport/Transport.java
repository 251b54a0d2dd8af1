package dev.catananti.publisher.service.transport;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * JSON-over-HTTP access to the platform, already authenticated.
 * Non-2xx responses and I/O failures error with {@link TransportException}.
 * An empty response body is emitted as an empty JSON object.
 */
public interface Transport {

    Mono<JsonNode> get(Endpoint endpoint, String path);

    Mono<JsonNode> post(Endpoint endpoint, String path, JsonNode body);

    Mono<JsonNode> put(Endpoint endpoint, String path, JsonNode body);

    Mono<Void> delete(Endpoint endpoint, String path);
}
