package dev.catananti.publisher.model;

import java.util.Objects;

/**
 * An image either already hosted ({@link Remote}) or carried inline as base64 ({@link Inline}).
 */
public sealed interface AssetReference permits AssetReference.Inline, AssetReference.Remote {

    String DATA_URI_PREFIX = "data:";
    String BASE64_MARKER = ";base64,";

    record Inline(String mimeType, String bytesBase64) implements AssetReference {

        public Inline {
            Objects.requireNonNull(mimeType, "mimeType");
            Objects.requireNonNull(bytesBase64, "bytesBase64");
        }

        public String toDataUri() {
            return DATA_URI_PREFIX + mimeType + BASE64_MARKER + bytesBase64;
        }

        /**
         * Decoded payload size, computed from the base64 length without decoding.
         */
        public long decodedSize() {
            int length = bytesBase64.length();
            int padding = bytesBase64.endsWith("==") ? 2 : bytesBase64.endsWith("=") ? 1 : 0;
            return (long) length / 4 * 3 - padding;
        }
    }

    record Remote(String url) implements AssetReference {

        public Remote {
            Objects.requireNonNull(url, "url");
        }
    }

    /**
     * Reads a {@code data:<mime>;base64,<payload>} URI or an http(s) URL.
     *
     * @throws IllegalArgumentException for anything else
     */
    static AssetReference parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Asset reference is empty");
        }
        String trimmed = value.trim();
        if (trimmed.startsWith(DATA_URI_PREFIX)) {
            int marker = trimmed.indexOf(BASE64_MARKER);
            if (marker < 0) {
                throw new IllegalArgumentException("Data URI must be base64 encoded");
            }
            return new Inline(trimmed.substring(DATA_URI_PREFIX.length(), marker),
                    trimmed.substring(marker + BASE64_MARKER.length()));
        }
        String lower = trimmed.toLowerCase();
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return new Remote(trimmed);
        }
        throw new IllegalArgumentException("Asset reference must be a data URI or an http(s) URL");
    }
}
