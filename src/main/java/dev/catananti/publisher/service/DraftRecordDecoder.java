package dev.catananti.publisher.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.catananti.publisher.document.ContentDocument;
import dev.catananti.publisher.document.DocumentJsonCodec;
import dev.catananti.publisher.model.DraftRecord;
import dev.catananti.publisher.model.SeoFields;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * The one place where loosely shaped draft/post JSON becomes a {@link DraftRecord}.
 * <p>
 * Draft endpoints answer with {@code draft_*} fields, post endpoints with the bare names;
 * the draft form wins. A field absent from the response keeps the value of {@code fallback}.
 */
@Component
@RequiredArgsConstructor
public class DraftRecordDecoder {

    private final DocumentJsonCodec documentCodec;

    public DraftRecord decode(JsonNode json, DraftRecord fallback) {
        DraftRecord base = fallback != null ? fallback : DraftRecord.builder().build();
        SeoFields seo = base.seo();
        return DraftRecord.builder()
                .id(json.hasNonNull("id") ? json.get("id").asLong() : base.id())
                .title(text(json, base.title(), "draft_title", "title"))
                .subtitle(text(json, base.subtitle(), "draft_subtitle", "subtitle"))
                .document(document(json, base.document()))
                .categoryId(number(json, base.categoryId(), "draft_section_id", "section_id"))
                .coverAssetUrl(text(json, base.coverAssetUrl(), "cover_image"))
                .tags(tags(json, base.tags()))
                .seo(SeoFields.builder()
                        .description(text(json, seo.description(), "description"))
                        .searchEngineTitle(text(json, seo.searchEngineTitle(), "search_engine_title"))
                        .searchEngineDescription(text(json, seo.searchEngineDescription(), "search_engine_description"))
                        .socialTitle(text(json, seo.socialTitle(), "social_title"))
                        .build())
                .published(json.hasNonNull("is_published") ? json.get("is_published").asBoolean() : base.published())
                .slug(text(json, base.slug(), "slug"))
                .canonicalUrl(text(json, base.canonicalUrl(), "canonical_url"))
                .build();
    }

    private ContentDocument document(JsonNode json, ContentDocument fallback) {
        JsonNode body = json.get("draft_body");
        if (body == null || body.isNull()) {
            body = json.get("body_json");
        }
        return body == null || body.isNull() ? fallback : documentCodec.fromJson(body);
    }

    private static String text(JsonNode json, String fallback, String... fields) {
        for (String field : fields) {
            JsonNode value = json.get(field);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return fallback;
    }

    private static Long number(JsonNode json, Long fallback, String... fields) {
        for (String field : fields) {
            JsonNode value = json.get(field);
            if (value != null && value.canConvertToLong()) {
                return value.asLong();
            }
        }
        return fallback;
    }

    /**
     * {@code postTags} comes back either as strings or as objects with a {@code name}.
     */
    private static List<String> tags(JsonNode json, List<String> fallback) {
        JsonNode node = json.get("postTags");
        if (node == null || !node.isArray()) {
            return fallback;
        }
        List<String> tags = new ArrayList<>();
        for (JsonNode tag : node) {
            String name = tag.isTextual() ? tag.asText() : tag.path("name").asText("");
            if (!name.isBlank()) {
                tags.add(name);
            }
        }
        return tags;
    }
}
