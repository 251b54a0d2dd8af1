package dev.catananti.publisher.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AssetReference")
class AssetReferenceTest {

    @Nested
    @DisplayName("parse()")
    class Parse {

        @Test
        @DisplayName("should read a base64 data URI as inline")
        void dataUri() {
            AssetReference reference = AssetReference.parse("data:image/png;base64,iVBORw0KGgo=");

            assertThat(reference).isEqualTo(new AssetReference.Inline("image/png", "iVBORw0KGgo="));
        }

        @Test
        @DisplayName("should read an http(s) URL as remote")
        void url() {
            assertThat(AssetReference.parse(" https://cdn.test/a.jpg "))
                    .isEqualTo(new AssetReference.Remote("https://cdn.test/a.jpg"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "ftp://x/a.png", "data:image/png,raw", "/local/file.png"})
        @DisplayName("should reject anything else")
        void rejects(String value) {
            assertThatThrownBy(() -> AssetReference.parse(value))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Inline")
    class Inline {

        @Test
        @DisplayName("should compute decoded size from base64 length")
        void decodedSize() {
            assertThat(new AssetReference.Inline("image/png", "AAAA").decodedSize()).isEqualTo(3);
            assertThat(new AssetReference.Inline("image/png", "AAA=").decodedSize()).isEqualTo(2);
            assertThat(new AssetReference.Inline("image/png", "AA==").decodedSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("should rebuild the data URI")
        void dataUri() {
            assertThat(new AssetReference.Inline("image/gif", "R0lG").toDataUri())
                    .isEqualTo("data:image/gif;base64,R0lG");
        }
    }
}
