package dev.catananti.publisher.document;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A span of text sharing one set of marks.
 * At most one mark per {@link MarkType}; marks are kept in canonical order.
 */
public record TextRun(String text, Set<Mark> marks) {

    public TextRun {
        Objects.requireNonNull(text, "text");
        marks = canonical(marks);
    }

    public static TextRun plain(String text) {
        return new TextRun(text, Set.of());
    }

    public static TextRun of(String text, Mark... marks) {
        return new TextRun(text, Set.of(marks));
    }

    public boolean hasMark(MarkType type) {
        return marks.stream().anyMatch(mark -> mark.type() == type);
    }

    public TextRun withText(String newText) {
        return new TextRun(newText, marks);
    }

    private static Set<Mark> canonical(Set<Mark> marks) {
        if (marks == null || marks.isEmpty()) {
            return Set.of();
        }
        TreeSet<Mark> byType = new TreeSet<>();
        for (Mark mark : marks) {
            // TreeSet compares by type only, so the first mark of a type wins
            byType.add(mark);
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(byType));
    }
}
