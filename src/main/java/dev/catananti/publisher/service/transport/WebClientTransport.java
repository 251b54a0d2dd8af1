package dev.catananti.publisher.service.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.catananti.publisher.config.PublisherProperties;
import dev.catananti.publisher.config.ResilienceConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * {@link Transport} over Spring's {@link WebClient}, one client per {@link Endpoint}.
 * Every request carries the session cookie; each host has its own circuit breaker.
 */
@Component
@Slf4j
public class WebClientTransport implements Transport {

    private static final String SESSION_COOKIE_NAME = "connect.sid";

    private final Map<Endpoint, WebClient> clients = new EnumMap<>(Endpoint.class);
    private final Map<Endpoint, CircuitBreaker> breakers = new EnumMap<>(Endpoint.class);
    private final Duration timeout;

    public WebClientTransport(WebClient.Builder webClientBuilder,
                              PublisherProperties properties,
                              ResilienceConfig resilience) {
        this.timeout = resilience.getExternalTimeout();
        clients.put(Endpoint.ACCOUNT, client(webClientBuilder, properties.accountBaseUrl(), properties.getSessionCookie()));
        clients.put(Endpoint.GLOBAL, client(webClientBuilder, properties.globalBaseUrl(), properties.getSessionCookie()));
        breakers.put(Endpoint.ACCOUNT, resilience.platformCircuitBreaker("platform-account"));
        breakers.put(Endpoint.GLOBAL, resilience.platformCircuitBreaker("platform-global"));
    }

    private static WebClient client(WebClient.Builder builder, String baseUrl, String sessionCookie) {
        return builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.COOKIE, SESSION_COOKIE_NAME + "=" + sessionCookie)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Mono<JsonNode> get(Endpoint endpoint, String path) {
        return exchange(endpoint, HttpMethod.GET, path, null);
    }

    @Override
    public Mono<JsonNode> post(Endpoint endpoint, String path, JsonNode body) {
        return exchange(endpoint, HttpMethod.POST, path, body);
    }

    @Override
    public Mono<JsonNode> put(Endpoint endpoint, String path, JsonNode body) {
        return exchange(endpoint, HttpMethod.PUT, path, body);
    }

    @Override
    public Mono<Void> delete(Endpoint endpoint, String path) {
        return exchange(endpoint, HttpMethod.DELETE, path, null).then();
    }

    private Mono<JsonNode> exchange(Endpoint endpoint, HttpMethod method, String path, JsonNode body) {
        WebClient.RequestBodySpec request = clients.get(endpoint).method(method).uri(path);
        WebClient.RequestHeadersSpec<?> spec = body == null
                ? request
                : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);

        log.debug("{} {} {}", method, endpoint, path);
        return spec.exchangeToMono(response -> readBody(endpoint, path, response))
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(breakers.get(endpoint)))
                // after the breaker, so an open breaker also surfaces as a TransportException
                .onErrorMap(e -> !(e instanceof TransportException), e -> new TransportException(endpoint, path, e));
    }

    private Mono<JsonNode> readBody(Endpoint endpoint, String path, ClientResponse response) {
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(JsonNode.class)
                    .defaultIfEmpty(JsonNodeFactory.instance.objectNode());
        }
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(text -> {
                    log.warn("Platform rejected {} {}: status={}", endpoint, path, status);
                    return Mono.<JsonNode>error(new TransportException(endpoint, path, status, text));
                });
    }
}
