package dev.catananti.publisher.document;

import java.util.List;

public record Paragraph(List<TextRun> inline) implements Block {

    public Paragraph {
        inline = List.copyOf(inline);
    }

    public static Paragraph plain(String text) {
        return new Paragraph(List.of(TextRun.plain(text)));
    }

    @Override
    public String plainText() {
        return join(inline);
    }

    static String join(List<TextRun> runs) {
        StringBuilder sb = new StringBuilder();
        for (TextRun run : runs) {
            sb.append(run.text());
        }
        return sb.toString();
    }
}
