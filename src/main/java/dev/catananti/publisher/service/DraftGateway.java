package dev.catananti.publisher.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.catananti.publisher.config.PublisherProperties;
import dev.catananti.publisher.document.DocumentJsonCodec;
import dev.catananti.publisher.exception.PublishPipelineException;
import dev.catananti.publisher.exception.RemoteRejectedException;
import dev.catananti.publisher.model.DraftContent;
import dev.catananti.publisher.model.DraftRecord;
import dev.catananti.publisher.model.PublishStage;
import dev.catananti.publisher.model.SeoFields;
import dev.catananti.publisher.service.transport.Endpoint;
import dev.catananti.publisher.service.transport.Transport;
import dev.catananti.publisher.service.transport.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Draft lifecycle commands. All of them go to the account endpoint.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DraftGateway {

    private static final String DRAFTS_PATH = "/api/v1/drafts";

    private final Transport transport;
    private final DocumentJsonCodec documentCodec;
    private final DraftRecordDecoder decoder;
    private final PublisherProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Creates an empty draft attributed to the configured author.
     */
    public Mono<DraftRecord> createDraft() {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("draft_bylines", bylines());

        return transport.post(Endpoint.ACCOUNT, DRAFTS_PATH, body)
                .onErrorMap(TransportException.class, e -> new RemoteRejectedException(PublishStage.CREATE_DRAFT, e))
                .flatMap(json -> {
                    if (!json.hasNonNull("id")) {
                        return Mono.error(new PublishPipelineException(
                                "CreateDraft response carried no draft id", PublishStage.CREATE_DRAFT, null));
                    }
                    DraftRecord draft = DraftRecord.created(json.get("id").asLong());
                    log.debug("Draft created: id={}", draft.id());
                    return Mono.just(draft);
                });
    }

    public Mono<DraftRecord> fetchDraft(long draftId) {
        return transport.get(Endpoint.ACCOUNT, draftPath(draftId))
                .onErrorMap(TransportException.class, e -> new RemoteRejectedException(PublishStage.FETCH_DRAFT, e))
                .map(json -> decoder.decode(json, DraftRecord.created(draftId)));
    }

    /**
     * Writes every content and metadata field of the draft. Fields left out are cleared by
     * the platform, so callers must always pass the complete content.
     */
    public Mono<DraftRecord> mergeContent(DraftContent content) {
        DraftRecord expected = DraftRecord.builder()
                .id(content.draftId())
                .title(content.title())
                .subtitle(content.subtitle())
                .document(content.document())
                .categoryId(content.categoryId())
                .coverAssetUrl(content.coverUrl())
                .tags(content.tags())
                .seo(content.seo())
                .build();

        log.debug("Merging content into draft {}: blocks={}, section={}, cover={}",
                content.draftId(), content.document().size(), content.categoryId(),
                content.coverUrl() != null && !content.coverUrl().isEmpty());
        return transport.put(Endpoint.ACCOUNT, draftPath(content.draftId()), mergeBody(content))
                .onErrorMap(TransportException.class, e -> new RemoteRejectedException(PublishStage.MERGE_CONTENT, e))
                .map(json -> decoder.decode(json, expected));
    }

    /**
     * Publishes a draft. Everything except the notification flag must already be merged.
     */
    public Mono<DraftRecord> publish(long draftId, boolean sendNotification) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("send", sendNotification);

        return transport.post(Endpoint.ACCOUNT, draftPath(draftId) + "/publish", body)
                .onErrorMap(TransportException.class, e -> new RemoteRejectedException(PublishStage.PUBLISH, e))
                .map(json -> decoder.decode(json, DraftRecord.created(draftId)).toBuilder()
                        .published(true)
                        .build());
    }

    public Mono<Void> deleteDraft(long draftId) {
        return transport.delete(Endpoint.ACCOUNT, draftPath(draftId))
                .onErrorMap(TransportException.class, e -> new RemoteRejectedException(PublishStage.DELETE_DRAFT, e))
                .doOnSuccess(v -> log.info("Draft deleted: id={}", draftId));
    }

    ObjectNode mergeBody(DraftContent content) {
        SeoFields seo = content.seo();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("draft_title", content.title());
        body.put("draft_subtitle", content.subtitle() == null ? "" : content.subtitle());
        body.put("draft_body", documentCodec.toJsonString(content.document()));
        body.set("draft_bylines", bylines());
        body.put("type", "newsletter");
        body.put("audience", content.settings().audience());
        body.put("editor_v2", true);
        body.put("description", seo.description());
        body.put("search_engine_title", seo.searchEngineTitle());
        body.put("search_engine_description", seo.searchEngineDescription());
        body.put("social_title", seo.socialTitle());
        if (content.coverUrl() == null || content.coverUrl().isEmpty()) {
            body.putNull("cover_image");
        } else {
            body.put("cover_image", content.coverUrl());
        }
        if (content.categoryId() == null) {
            body.putNull("draft_section_id");
        } else {
            body.put("draft_section_id", content.categoryId());
        }
        body.put("section_chosen", content.categoryId() != null);
        ArrayNode tags = body.putArray("postTags");
        content.tags().forEach(tags::add);
        body.put("write_comment_permissions", content.settings().commentPermissions());
        body.put("default_comment_sort", content.settings().commentSort());
        return body;
    }

    private ArrayNode bylines() {
        ArrayNode bylines = objectMapper.createArrayNode();
        if (properties.getAuthorId() != null) {
            bylines.addObject()
                    .put("id", properties.getAuthorId())
                    .put("is_guest", false);
        }
        return bylines;
    }

    private static String draftPath(long draftId) {
        return DRAFTS_PATH + "/" + draftId;
    }

}
