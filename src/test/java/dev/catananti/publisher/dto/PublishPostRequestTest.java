package dev.catananti.publisher.dto;

import dev.catananti.publisher.model.AssetReference;
import dev.catananti.publisher.model.BodyFormat;
import dev.catananti.publisher.model.PublishRequest;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublishPostRequestTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    @DisplayName("Should apply defaults when optional fields are absent")
    void shouldApplyDefaults() {
        PublishRequest request = PublishPostRequest.builder().title("Hello").build().toPublishRequest();

        assertThat(request.bodyFormat()).isEqualTo(BodyFormat.HTML);
        assertThat(request.body()).isEmpty();
        assertThat(request.coverImage()).isNull();
        assertThat(request.tags()).isEmpty();
        assertThat(request.settings().audience()).isEqualTo("everyone");
        assertThat(request.settings().commentSort()).isEqualTo("best_first");
        assertThat(request.wantsShare()).isFalse();
    }

    @Test
    @DisplayName("Should parse an inline cover image")
    void shouldParseInlineCover() {
        PublishRequest request = PublishPostRequest.builder()
                .title("Hello")
                .coverImage("data:image/jpeg;base64,/9j/4AAQ")
                .build()
                .toPublishRequest();

        assertThat(request.coverImage()).isEqualTo(new AssetReference.Inline("image/jpeg", "/9j/4AAQ"));
    }

    @Test
    @DisplayName("Should reject a data URI that is not base64")
    void shouldRejectRawDataUri() {
        PublishPostRequest request = PublishPostRequest.builder()
                .title("Hello")
                .coverImage("data:image/png,raw")
                .build();

        assertThatThrownBy(request::toPublishRequest).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should flag a missing title and an unknown body format")
    void shouldValidate() {
        PublishPostRequest request = PublishPostRequest.builder()
                .bodyFormat("RTF")
                .coverImage("ftp://host/a.png")
                .build();

        assertThat(validator.validate(request))
                .extracting(violation -> violation.getPropertyPath().toString())
                .containsExactlyInAnyOrder("title", "bodyFormat", "coverImage");
    }
}
