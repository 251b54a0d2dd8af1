package dev.catananti.publisher.document;

/**
 * A markup fragment that could not be represented as-is and fell back to plain text
 * (or, for stray list items, was dropped).
 */
public record ConversionDegraded(Reason reason, String fragment) {

    public enum Reason {
        UNWRAPPED_TEXT,
        UNSUPPORTED_BLOCK,
        UNTERMINATED_TAG,
        STRAY_LIST_CONTENT
    }
}
