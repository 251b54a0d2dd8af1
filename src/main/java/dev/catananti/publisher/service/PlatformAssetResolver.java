package dev.catananti.publisher.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.catananti.publisher.config.PublisherProperties;
import dev.catananti.publisher.exception.AssetUploadFailedException;
import dev.catananti.publisher.model.AssetReference;
import dev.catananti.publisher.service.transport.Endpoint;
import dev.catananti.publisher.service.transport.Transport;
import dev.catananti.publisher.service.transport.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Uploads inline images to the platform's image host. Remote URLs pass through untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlatformAssetResolver implements AssetResolver {

    static final String IMAGE_PATH = "/api/v1/image";
    private static final String IMAGE_MIME_PREFIX = "image/";

    private final Transport transport;
    private final PublisherProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<AssetReference.Remote> resolve(AssetReference reference, long forDraftId) {
        if (reference instanceof AssetReference.Remote remote) {
            return Mono.just(remote);
        }
        AssetReference.Inline inline = (AssetReference.Inline) reference;

        if (!inline.mimeType().toLowerCase().startsWith(IMAGE_MIME_PREFIX)) {
            return Mono.error(new AssetUploadFailedException(
                    "Only images can be uploaded, got " + inline.mimeType()));
        }
        long size = inline.decodedSize();
        if (size > properties.getMaxUploadBytes()) {
            return Mono.error(new AssetUploadFailedException(
                    "Image of " + size + " bytes exceeds the upload limit of " + properties.getMaxUploadBytes()));
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("image", inline.toDataUri());
        body.put("postId", forDraftId);

        return transport.post(Endpoint.GLOBAL, IMAGE_PATH, body)
                .onErrorMap(TransportException.class,
                        e -> new AssetUploadFailedException("Image upload rejected: " + e.getMessage(), e))
                .flatMap(json -> {
                    String url = json.path("url").asText("");
                    if (url.isBlank()) {
                        return Mono.error(new AssetUploadFailedException("Image upload response carried no url"));
                    }
                    log.info("Image uploaded for draft {}: {} bytes, {}", forDraftId, size, inline.mimeType());
                    return Mono.just(new AssetReference.Remote(url));
                });
    }
}
