package dev.catananti.publisher.document;

import java.util.List;

public record Heading(int level, List<TextRun> inline) implements Block {

    public static final int MIN_LEVEL = 2;
    public static final int MAX_LEVEL = 3;

    public Heading {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Heading level must be between " + MIN_LEVEL + " and " + MAX_LEVEL + ": " + level);
        }
        inline = List.copyOf(inline);
    }

    @Override
    public String plainText() {
        return Paragraph.join(inline);
    }
}
