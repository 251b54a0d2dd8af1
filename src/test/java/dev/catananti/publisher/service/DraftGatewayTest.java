package dev.catananti.publisher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.publisher.config.PublisherProperties;
import dev.catananti.publisher.document.DocumentConverter;
import dev.catananti.publisher.document.DocumentJsonCodec;
import dev.catananti.publisher.exception.PublishPipelineException;
import dev.catananti.publisher.exception.RemoteRejectedException;
import dev.catananti.publisher.model.DraftContent;
import dev.catananti.publisher.model.PublishStage;
import dev.catananti.publisher.model.SeoFields;
import dev.catananti.publisher.service.transport.Endpoint;
import dev.catananti.publisher.service.transport.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DraftGateway")
class DraftGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DocumentJsonCodec codec = new DocumentJsonCodec(objectMapper);
    private RecordingTransport transport;
    private DraftGateway gateway;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        PublisherProperties properties = new PublisherProperties(
                "pub.substack.com", "substack.com", "sid", 77L, null, 1024, "showWelcomeOnShare=true");
        gateway = new DraftGateway(transport, codec, new DraftRecordDecoder(codec), properties, objectMapper);
    }

    @Nested
    @DisplayName("createDraft()")
    class CreateDraft {

        @Test
        @DisplayName("should post bylines and return an empty unpublished draft")
        void creates() {
            transport.on("POST", Endpoint.ACCOUNT, "/api/v1/drafts", objectMapper.createObjectNode().put("id", 101));

            StepVerifier.create(gateway.createDraft())
                    .assertNext(draft -> {
                        assertThat(draft.id()).isEqualTo(101L);
                        assertThat(draft.published()).isFalse();
                        assertThat(draft.document().isEmpty()).isTrue();
                    })
                    .verifyComplete();

            JsonNode byline = transport.calls().get(0).body().path("draft_bylines").get(0);
            assertThat(byline.path("id").asLong()).isEqualTo(77L);
            assertThat(byline.path("is_guest").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("should tag rejections with the CreateDraft stage")
        void rejected() {
            transport.fail("POST", Endpoint.ACCOUNT, "/api/v1/drafts", 401, "not logged in");

            StepVerifier.create(gateway.createDraft())
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(RemoteRejectedException.class);
                        RemoteRejectedException rejected = (RemoteRejectedException) e;
                        assertThat(rejected.getStage()).isEqualTo(PublishStage.CREATE_DRAFT);
                        assertThat(rejected.getStatus()).isEqualTo(401);
                        assertThat(rejected.getDraft()).isEmpty();
                    })
                    .verify();
        }

        @Test
        @DisplayName("should fail when the response carries no id")
        void missingId() {
            transport.on("POST", Endpoint.ACCOUNT, "/api/v1/drafts", objectMapper.createObjectNode());

            StepVerifier.create(gateway.createDraft())
                    .expectError(PublishPipelineException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("mergeContent()")
    class MergeContent {

        @Test
        @DisplayName("should send the full content with section chosen")
        void sendsFullBody() {
            transport.on("PUT", Endpoint.ACCOUNT, "/api/v1/drafts/101", objectMapper.createObjectNode().put("id", 101));
            DraftContent content = DraftContent.builder()
                    .draftId(101L)
                    .title("Title")
                    .subtitle("Sub")
                    .document(new DocumentConverter().convert("<p>Body</p>"))
                    .coverUrl("https://cdn.test/c.png")
                    .categoryId(9L)
                    .tags(List.of("java"))
                    .seo(SeoFields.builder().description("desc").build())
                    .build();

            StepVerifier.create(gateway.mergeContent(content))
                    .assertNext(draft -> {
                        assertThat(draft.title()).isEqualTo("Title");
                        assertThat(draft.categoryId()).isEqualTo(9L);
                        assertThat(draft.coverAssetUrl()).isEqualTo("https://cdn.test/c.png");
                        assertThat(draft.document().plainText()).isEqualTo("Body");
                    })
                    .verifyComplete();

            JsonNode body = transport.calls("PUT", "/api/v1/drafts/101").get(0).body();
            assertThat(body.path("draft_title").asText()).isEqualTo("Title");
            assertThat(body.path("draft_body").isTextual()).isTrue();
            assertThat(codec.fromJson(body.path("draft_body")).plainText()).isEqualTo("Body");
            assertThat(body.path("draft_section_id").asLong()).isEqualTo(9L);
            assertThat(body.path("section_chosen").asBoolean()).isTrue();
            assertThat(body.path("cover_image").asText()).isEqualTo("https://cdn.test/c.png");
            assertThat(body.path("postTags").get(0).asText()).isEqualTo("java");
            assertThat(body.path("description").asText()).isEqualTo("desc");
            assertThat(body.path("audience").asText()).isEqualTo("everyone");
            assertThat(body.path("write_comment_permissions").asText()).isEqualTo("everyone");
        }

        @Test
        @DisplayName("should send a null cover when none was resolved")
        void nullCover() {
            transport.on("PUT", Endpoint.ACCOUNT, "/api/v1/drafts/5", objectMapper.createObjectNode());
            DraftContent content = DraftContent.builder().draftId(5L).title("T").coverUrl("").categoryId(1L).build();

            StepVerifier.create(gateway.mergeContent(content))
                    .assertNext(draft -> assertThat(draft.coverAssetUrl()).isEmpty())
                    .verifyComplete();

            assertThat(transport.calls().get(0).body().path("cover_image").isNull()).isTrue();
        }

        @Test
        @DisplayName("should tag rejections with the MergeContent stage")
        void rejected() {
            transport.fail("PUT", Endpoint.ACCOUNT, "/api/v1/drafts/5", 500, "boom");

            StepVerifier.create(gateway.mergeContent(DraftContent.builder().draftId(5L).title("T").build()))
                    .expectErrorMatches(e -> e instanceof RemoteRejectedException rejected
                            && rejected.getStage() == PublishStage.MERGE_CONTENT)
                    .verify();
        }
    }

    @Nested
    @DisplayName("publish()")
    class Publish {

        @Test
        @DisplayName("should send the notification flag and mark the record published")
        void publishes() {
            transport.on("POST", Endpoint.ACCOUNT, "/api/v1/drafts/101/publish", objectMapper.createObjectNode()
                    .put("id", 101)
                    .put("slug", "title")
                    .put("canonical_url", "https://pub.substack.com/p/title"));

            StepVerifier.create(gateway.publish(101L, true))
                    .assertNext(draft -> {
                        assertThat(draft.published()).isTrue();
                        assertThat(draft.slug()).isEqualTo("title");
                        assertThat(draft.canonicalUrl()).isEqualTo("https://pub.substack.com/p/title");
                    })
                    .verifyComplete();

            assertThat(transport.calls().get(0).body().path("send").asBoolean()).isTrue();
        }
    }

    @Nested
    @DisplayName("fetchDraft() / deleteDraft()")
    class FetchAndDelete {

        @Test
        @DisplayName("should decode a fetched draft")
        void fetches() {
            transport.on("GET", Endpoint.ACCOUNT, "/api/v1/drafts/9", objectMapper.createObjectNode()
                    .put("id", 9)
                    .put("draft_title", "Saved")
                    .put("is_published", false));

            StepVerifier.create(gateway.fetchDraft(9L))
                    .assertNext(draft -> {
                        assertThat(draft.id()).isEqualTo(9L);
                        assertThat(draft.title()).isEqualTo("Saved");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should tag a missing draft with the FetchDraft stage")
        void fetchMissing() {
            StepVerifier.create(gateway.fetchDraft(404L))
                    .expectErrorMatches(e -> e instanceof RemoteRejectedException rejected
                            && rejected.getStage() == PublishStage.FETCH_DRAFT
                            && rejected.getStatus() == 404)
                    .verify();
        }

        @Test
        @DisplayName("should issue a delete on the account endpoint")
        void deletes() {
            StepVerifier.create(gateway.deleteDraft(9L))
                    .verifyComplete();

            assertThat(transport.calls("DELETE", "/api/v1/drafts/9")).hasSize(1);
        }
    }
}
