package dev.catananti.publisher.document;

/**
 * Lexical unit produced by {@link MarkupTokenizer}.
 * For tags {@code value} is the lower-cased tag name; for text it is the decoded text.
 */
record MarkupToken(Kind kind, String value, String href) {

    enum Kind {
        TEXT,
        OPEN,
        CLOSE,
        SELF_CLOSING,
        /** Everything from a malformed tag boundary to the end of input, kept literally. */
        RAW_TAIL
    }

    static MarkupToken text(String text) {
        return new MarkupToken(Kind.TEXT, text, null);
    }

    static MarkupToken rawTail(String text) {
        return new MarkupToken(Kind.RAW_TAIL, text, null);
    }

    boolean isOpen(String name) {
        return kind == Kind.OPEN && value.equals(name);
    }

    boolean isClose(String name) {
        return kind == Kind.CLOSE && value.equals(name);
    }

    boolean isText() {
        return kind == Kind.TEXT || kind == Kind.RAW_TAIL;
    }
}
