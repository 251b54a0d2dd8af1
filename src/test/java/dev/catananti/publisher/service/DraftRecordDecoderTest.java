package dev.catananti.publisher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.publisher.document.DocumentJsonCodec;
import dev.catananti.publisher.document.Paragraph;
import dev.catananti.publisher.model.DraftRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DraftRecordDecoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DraftRecordDecoder decoder = new DraftRecordDecoder(new DocumentJsonCodec(objectMapper));

    @Test
    @DisplayName("Should prefer draft_* fields and decode the body string")
    void shouldDecodeDraftFields() throws Exception {
        JsonNode json = objectMapper.readTree("""
                {"id": 42, "draft_title": "Draft title", "title": "Old title",
                 "draft_subtitle": "Sub", "draft_section_id": 9, "cover_image": "https://cdn.test/c.png",
                 "draft_body": "{\\"type\\":\\"doc\\",\\"content\\":[{\\"type\\":\\"paragraph\\",\\"content\\":[{\\"type\\":\\"text\\",\\"text\\":\\"Hi\\"}]}]}",
                 "postTags": [{"name": "java"}, "reactive"],
                 "search_engine_title": "SEO", "is_published": false}
                """);

        DraftRecord draft = decoder.decode(json, null);

        assertThat(draft.id()).isEqualTo(42L);
        assertThat(draft.title()).isEqualTo("Draft title");
        assertThat(draft.subtitle()).isEqualTo("Sub");
        assertThat(draft.categoryId()).isEqualTo(9L);
        assertThat(draft.coverAssetUrl()).isEqualTo("https://cdn.test/c.png");
        assertThat(draft.document().blocks()).containsExactly(Paragraph.plain("Hi"));
        assertThat(draft.tags()).containsExactly("java", "reactive");
        assertThat(draft.seo().searchEngineTitle()).isEqualTo("SEO");
        assertThat(draft.published()).isFalse();
    }

    @Test
    @DisplayName("Should read published post fields")
    void shouldDecodePostFields() throws Exception {
        JsonNode json = objectMapper.readTree("""
                {"id": 42, "title": "Live", "section_id": 3, "slug": "live",
                 "canonical_url": "https://pub.substack.com/p/live", "is_published": true}
                """);

        DraftRecord draft = decoder.decode(json, null);

        assertThat(draft.title()).isEqualTo("Live");
        assertThat(draft.categoryId()).isEqualTo(3L);
        assertThat(draft.slug()).isEqualTo("live");
        assertThat(draft.canonicalUrl()).isEqualTo("https://pub.substack.com/p/live");
        assertThat(draft.published()).isTrue();
    }

    @Test
    @DisplayName("Should keep fallback values for absent fields")
    void shouldUseFallback() {
        DraftRecord fallback = DraftRecord.builder()
                .id(5L)
                .title("Kept")
                .categoryId(8L)
                .tags(List.of("a"))
                .build();

        DraftRecord draft = decoder.decode(objectMapper.createObjectNode(), fallback);

        assertThat(draft).isEqualTo(fallback);
    }
}
