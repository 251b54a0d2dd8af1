package dev.catananti.publisher.document;

/**
 * Inline mark kinds supported by the platform's document schema.
 * Declaration order is the canonical order of marks on a {@link TextRun}.
 */
public enum MarkType {
    BOLD("strong"),
    ITALIC("em"),
    STRIKETHROUGH("strikethrough"),
    CODE("code"),
    LINK("link");

    private final String wireName;

    MarkType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static MarkType fromWireName(String wireName) {
        for (MarkType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }
}
