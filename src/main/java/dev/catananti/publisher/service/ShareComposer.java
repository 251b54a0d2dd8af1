package dev.catananti.publisher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.catananti.publisher.config.PublisherProperties;
import dev.catananti.publisher.document.ContentDocument;
import dev.catananti.publisher.document.DocumentJsonCodec;
import dev.catananti.publisher.document.Paragraph;
import dev.catananti.publisher.exception.RemoteRejectedException;
import dev.catananti.publisher.exception.ShareFailedException;
import dev.catananti.publisher.model.DraftRecord;
import dev.catananti.publisher.model.PublishStage;
import dev.catananti.publisher.model.ShareNote;
import dev.catananti.publisher.service.transport.Endpoint;
import dev.catananti.publisher.service.transport.Transport;
import dev.catananti.publisher.service.transport.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Promotes a published post as a short-form note with a link attachment.
 * The attachment is registered on the global host, the note on the account host.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShareComposer {

    static final String ATTACHMENT_PATH = "/api/v1/comment/attachment";
    static final String NOTE_PATH = "/api/v1/comment/feed";
    private static final String REPLY_MINIMUM_ROLE = "everyone";

    private final Transport transport;
    private final DocumentJsonCodec documentCodec;
    private final PublisherProperties properties;
    private final ObjectMapper objectMapper;

    public Mono<ShareNote> shareAsNote(DraftRecord draft, String text) {
        if (!draft.published()) {
            return Mono.error(new ShareFailedException("Draft " + draft.id() + " is not published", draft));
        }
        if (text == null || text.isBlank()) {
            return Mono.error(new ShareFailedException("Share text is empty", draft));
        }
        String sharedUrl = sharedUrl(draft);

        ObjectNode attachment = objectMapper.createObjectNode();
        attachment.put("type", "link");
        attachment.put("url", sharedUrl);

        return transport.post(Endpoint.GLOBAL, ATTACHMENT_PATH, attachment)
                .flatMap(json -> {
                    if (!json.hasNonNull("id")) {
                        return Mono.error(new ShareFailedException("Attachment response carried no id", draft));
                    }
                    JsonNode attachmentId = json.get("id");
                    log.debug("Link attachment {} registered for {}", attachmentId, sharedUrl);
                    return transport.post(Endpoint.ACCOUNT, NOTE_PATH, noteBody(text, attachmentId))
                            .map(note -> new ShareNote(note.path("id").asLong(0), attachmentId.asText(), sharedUrl, text));
                })
                .onErrorMap(TransportException.class, e -> new ShareFailedException(
                        "Sharing post " + draft.id() + " failed: " + e.getMessage(), draft,
                        new RemoteRejectedException(PublishStage.SHARE_AS_NOTE, draft, e)))
                .doOnNext(note -> log.info("Shared post {} as note {}", draft.id(), note.id()));
    }

    /**
     * Public URL of the post with the share tracking parameter appended.
     * Falls back to the publication home page when the record has neither canonical url nor slug.
     */
    public String sharedUrl(DraftRecord draft) {
        String base;
        if (draft.canonicalUrl() != null && !draft.canonicalUrl().isBlank()) {
            base = draft.canonicalUrl();
        } else if (draft.slug() != null && !draft.slug().isBlank()) {
            base = properties.accountBaseUrl() + "/p/" + draft.slug();
        } else {
            log.warn("Post {} has neither canonical url nor slug, sharing the publication home page", draft.id());
            base = properties.accountBaseUrl();
        }
        String parameter = properties.getShareTrackingParameter();
        if (parameter == null || parameter.isBlank() || base.contains(parameter)) {
            return base;
        }
        return base + (base.contains("?") ? "&" : "?") + parameter;
    }

    /**
     * The attachment id is opaque (numeric or string) and is sent back exactly as received.
     */
    private ObjectNode noteBody(String text, JsonNode attachmentId) {
        ObjectNode bodyJson = documentCodec.toJson(new ContentDocument(List.of(Paragraph.plain(text.strip()))));
        bodyJson.putObject("attrs").put("schemaVersion", "v1");

        ObjectNode body = objectMapper.createObjectNode();
        body.set("bodyJson", bodyJson);
        body.putArray("attachmentIds").add(attachmentId);
        body.put("replyMinimumRole", REPLY_MINIMUM_ROLE);
        return body;
    }
}
