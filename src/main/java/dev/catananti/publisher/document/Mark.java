package dev.catananti.publisher.document;

import java.util.Objects;

/**
 * A single inline mark. Only {@link MarkType#LINK} carries an {@code href}.
 */
public record Mark(MarkType type, String href) implements Comparable<Mark> {

    public static final Mark BOLD = new Mark(MarkType.BOLD, null);
    public static final Mark ITALIC = new Mark(MarkType.ITALIC, null);
    public static final Mark STRIKETHROUGH = new Mark(MarkType.STRIKETHROUGH, null);
    public static final Mark CODE = new Mark(MarkType.CODE, null);

    public Mark {
        Objects.requireNonNull(type, "type");
        if (type != MarkType.LINK) {
            href = null;
        } else if (href == null) {
            href = "";
        }
    }

    public static Mark link(String href) {
        return new Mark(MarkType.LINK, href);
    }

    public static Mark of(MarkType type) {
        return switch (type) {
            case BOLD -> BOLD;
            case ITALIC -> ITALIC;
            case STRIKETHROUGH -> STRIKETHROUGH;
            case CODE -> CODE;
            case LINK -> link("");
        };
    }

    @Override
    public int compareTo(Mark other) {
        return type.compareTo(other.type);
    }
}
