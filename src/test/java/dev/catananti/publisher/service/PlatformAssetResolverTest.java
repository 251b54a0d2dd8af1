package dev.catananti.publisher.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.publisher.config.PublisherProperties;
import dev.catananti.publisher.exception.AssetUploadFailedException;
import dev.catananti.publisher.model.AssetReference;
import dev.catananti.publisher.service.transport.Endpoint;
import dev.catananti.publisher.service.transport.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PlatformAssetResolver")
class PlatformAssetResolverTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RecordingTransport transport;
    private PlatformAssetResolver resolver;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        PublisherProperties properties = new PublisherProperties(
                "pub.substack.com", "substack.com", "sid", 1L, 7L, 1024, "showWelcomeOnShare=true");
        resolver = new PlatformAssetResolver(transport, properties, objectMapper);
    }

    @Nested
    @DisplayName("Remote references")
    class Remote {

        @Test
        @DisplayName("should pass through without any transport call")
        void passthrough() {
            AssetReference.Remote remote = new AssetReference.Remote("https://cdn.test/cover.png");

            StepVerifier.create(resolver.resolve(remote, 11L))
                    .expectNext(remote)
                    .verifyComplete();

            assertThat(transport.callCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Inline references")
    class Inline {

        @Test
        @DisplayName("should upload once to the global image endpoint")
        void uploads() {
            transport.on("POST", Endpoint.GLOBAL, "/api/v1/image",
                    objectMapper.createObjectNode().put("url", "https://cdn.substack.test/img/1.png"));

            StepVerifier.create(resolver.resolve(new AssetReference.Inline("image/png", "AAAA"), 11L))
                    .expectNext(new AssetReference.Remote("https://cdn.substack.test/img/1.png"))
                    .verifyComplete();

            assertThat(transport.calls()).singleElement().satisfies(call -> {
                assertThat(call.endpoint()).isEqualTo(Endpoint.GLOBAL);
                assertThat(call.body().path("image").asText()).isEqualTo("data:image/png;base64,AAAA");
                assertThat(call.body().path("postId").asLong()).isEqualTo(11L);
            });
        }

        @Test
        @DisplayName("should reject non-image payloads before uploading")
        void rejectsNonImage() {
            StepVerifier.create(resolver.resolve(new AssetReference.Inline("application/pdf", "AAAA"), 11L))
                    .expectError(AssetUploadFailedException.class)
                    .verify();

            assertThat(transport.callCount()).isZero();
        }

        @Test
        @DisplayName("should reject payloads over the upload limit")
        void rejectsOversized() {
            String payload = "A".repeat(2000);

            StepVerifier.create(resolver.resolve(new AssetReference.Inline("image/jpeg", payload), 11L))
                    .expectErrorMatches(e -> e instanceof AssetUploadFailedException
                            && e.getMessage().contains("exceeds the upload limit"))
                    .verify();

            assertThat(transport.callCount()).isZero();
        }

        @Test
        @DisplayName("should fail when the platform rejects the upload")
        void platformRejects() {
            transport.fail("POST", Endpoint.GLOBAL, "/api/v1/image", 413, "too large");

            StepVerifier.create(resolver.resolve(new AssetReference.Inline("image/png", "AAAA"), 11L))
                    .expectErrorMatches(e -> e instanceof AssetUploadFailedException
                            && e.getCause() != null)
                    .verify();
        }

        @Test
        @DisplayName("should fail when the response has no url")
        void missingUrl() {
            transport.on("POST", Endpoint.GLOBAL, "/api/v1/image", objectMapper.createObjectNode());

            StepVerifier.create(resolver.resolve(new AssetReference.Inline("image/png", "AAAA"), 11L))
                    .expectError(AssetUploadFailedException.class)
                    .verify();
        }
    }
}
