package dev.catananti.publisher.document;

import dev.catananti.publisher.document.ConversionDegraded.Reason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts the supported markup subset into a {@link ContentDocument}.
 * <p>
 * Blocks: {@code h2}-{@code h4} (h4 becomes level 3), {@code p}, {@code ul}/{@code ol} with {@code li}.
 * Inline: {@code strong}/{@code b}, {@code em}/{@code i}, {@code s}/{@code strike}/{@code del},
 * {@code code} and {@code a href}.
 * <p>
 * Conversion never fails. Anything the schema cannot hold degrades to a plain paragraph of its
 * text and is reported as a {@link ConversionDegraded}. Pure and stateless.
 */
@Component
@Slf4j
public class DocumentConverter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> BLOCK_TAGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6", "p", "ul", "ol", "li");

    private static final Map<String, MarkType> INLINE_TAGS = Map.of(
            "strong", MarkType.BOLD,
            "b", MarkType.BOLD,
            "em", MarkType.ITALIC,
            "i", MarkType.ITALIC,
            "s", MarkType.STRIKETHROUGH,
            "strike", MarkType.STRIKETHROUGH,
            "del", MarkType.STRIKETHROUGH,
            "code", MarkType.CODE,
            "a", MarkType.LINK
    );

    public ContentDocument convert(String markup) {
        return convertWithReport(markup).document();
    }

    public ConversionReport convertWithReport(String markup) {
        if (markup == null || markup.isBlank()) {
            return new ConversionReport(ContentDocument.empty(), List.of());
        }
        Scan scan = new Scan(MarkupTokenizer.tokenize(markup));
        scan.run();
        if (!scan.degradations.isEmpty()) {
            log.debug("Markup conversion degraded {} fragment(s): {}", scan.degradations.size(), scan.degradations);
        }
        return new ConversionReport(new ContentDocument(scan.blocks), scan.degradations);
    }

    /**
     * One conversion pass. Holds the per-call mutable state so the converter itself stays stateless.
     */
    private static final class Scan {

        private final List<MarkupToken> tokens;
        private final List<Block> blocks = new ArrayList<>();
        private final List<ConversionDegraded> degradations = new ArrayList<>();
        private final List<MarkupToken> loose = new ArrayList<>();

        Scan(List<MarkupToken> tokens) {
            this.tokens = tokens;
        }

        void run() {
            int i = 0;
            while (i < tokens.size()) {
                MarkupToken token = tokens.get(i);
                if (token.kind() != MarkupToken.Kind.OPEN || !BLOCK_TAGS.contains(token.value())) {
                    loose.add(token);
                    i++;
                    continue;
                }
                flushLoose();
                int end = findClose(tokens, i, tokens.size(), token.value());
                if (end < 0) {
                    List<MarkupToken> rest = tokens.subList(i + 1, tokens.size());
                    degrade(Reason.UNTERMINATED_TAG, "<" + token.value() + ">", rest);
                    return;
                }
                block(token.value(), tokens.subList(i + 1, end));
                i = end + 1;
            }
            flushLoose();
        }

        private void block(String tag, List<MarkupToken> inner) {
            switch (tag) {
                case "h2", "h3", "h4" -> {
                    List<TextRun> runs = inline(inner);
                    if (!runs.isEmpty()) {
                        int level = Math.min(tag.charAt(1) - '0', Heading.MAX_LEVEL);
                        blocks.add(new Heading(level, runs));
                    }
                }
                case "p" -> {
                    List<TextRun> runs = inline(inner);
                    if (!runs.isEmpty()) {
                        blocks.add(new Paragraph(runs));
                    }
                }
                case "ul" -> {
                    List<Paragraph> items = listItems(inner);
                    if (!items.isEmpty()) {
                        blocks.add(new BulletList(items));
                    }
                }
                case "ol" -> {
                    List<Paragraph> items = listItems(inner);
                    if (!items.isEmpty()) {
                        blocks.add(new OrderedList(items));
                    }
                }
                // li without a list ancestor has no representation
                case "li" -> { }
                default -> degrade(Reason.UNSUPPORTED_BLOCK, "<" + tag + ">", inner);
            }
        }

        private List<Paragraph> listItems(List<MarkupToken> inner) {
            List<Paragraph> items = new ArrayList<>();
            int j = 0;
            while (j < inner.size()) {
                MarkupToken token = inner.get(j);
                if (token.isOpen("li")) {
                    int end = findClose(inner, j, inner.size(), "li");
                    if (end < 0) {
                        String text = extractText(inner.subList(j + 1, inner.size()));
                        if (!text.isEmpty()) {
                            items.add(Paragraph.plain(text));
                        }
                        degradations.add(new ConversionDegraded(Reason.UNTERMINATED_TAG, "<li>" + text));
                        break;
                    }
                    List<TextRun> runs = inline(inner.subList(j + 1, end));
                    if (!runs.isEmpty()) {
                        items.add(new Paragraph(runs));
                    }
                    j = end + 1;
                    continue;
                }
                if (token.isText() && !token.value().isBlank()) {
                    degradations.add(new ConversionDegraded(Reason.STRAY_LIST_CONTENT, token.value().strip()));
                }
                j++;
            }
            return items;
        }

        private void flushLoose() {
            if (loose.isEmpty()) {
                return;
            }
            String text = extractText(loose);
            boolean malformed = loose.stream().anyMatch(t -> t.kind() == MarkupToken.Kind.RAW_TAIL);
            loose.clear();
            if (!text.isEmpty()) {
                blocks.add(Paragraph.plain(text));
                degradations.add(new ConversionDegraded(malformed ? Reason.UNTERMINATED_TAG : Reason.UNWRAPPED_TEXT, text));
            }
        }

        private void degrade(Reason reason, String marker, List<MarkupToken> fragment) {
            String text = extractText(fragment);
            if (!text.isEmpty()) {
                blocks.add(Paragraph.plain(text));
            }
            degradations.add(new ConversionDegraded(reason, marker + text));
        }
    }

    /**
     * Resolves inline marks with an open-mark stack. Adjacent text under the same active
     * marks is merged into one run, so nested tags yield a single run with the union of marks.
     */
    static List<TextRun> inline(List<MarkupToken> tokens) {
        Deque<OpenMark> open = new ArrayDeque<>();
        List<TextRun> runs = new ArrayList<>();
        for (MarkupToken token : tokens) {
            switch (token.kind()) {
                case OPEN -> {
                    MarkType type = INLINE_TAGS.get(token.value());
                    if (type != null) {
                        Mark mark = type == MarkType.LINK ? Mark.link(token.href()) : Mark.of(type);
                        open.push(new OpenMark(token.value(), mark));
                    } else if ("br".equals(token.value())) {
                        append(runs, " ", activeMarks(open));
                    }
                }
                case SELF_CLOSING -> {
                    if ("br".equals(token.value())) {
                        append(runs, " ", activeMarks(open));
                    }
                }
                case CLOSE -> closeMark(open, token.value());
                case TEXT, RAW_TAIL -> append(runs, token.value(), activeMarks(open));
            }
        }
        return trim(runs);
    }

    private static void closeMark(Deque<OpenMark> open, String tag) {
        // Deque iterates from the most recently pushed mark
        Iterator<OpenMark> it = open.iterator();
        while (it.hasNext()) {
            if (it.next().tag().equals(tag)) {
                it.remove();
                return;
            }
        }
    }

    private static Set<Mark> activeMarks(Deque<OpenMark> open) {
        Set<Mark> marks = new HashSet<>();
        Set<MarkType> seen = new HashSet<>();
        for (OpenMark openMark : open) {
            if (seen.add(openMark.mark().type())) {
                marks.add(openMark.mark());
            }
        }
        return marks;
    }

    private static void append(List<TextRun> runs, String raw, Set<Mark> marks) {
        String text = WHITESPACE.matcher(raw).replaceAll(" ");
        if (text.isEmpty()) {
            return;
        }
        if (!runs.isEmpty()) {
            TextRun last = runs.get(runs.size() - 1);
            if (last.text().endsWith(" ") && text.startsWith(" ")) {
                text = text.substring(1);
                if (text.isEmpty()) {
                    return;
                }
            }
            TextRun candidate = new TextRun(text, marks);
            if (last.marks().equals(candidate.marks())) {
                runs.set(runs.size() - 1, last.withText(last.text() + text));
                return;
            }
            runs.add(candidate);
            return;
        }
        runs.add(new TextRun(text, marks));
    }

    private static List<TextRun> trim(List<TextRun> runs) {
        List<TextRun> result = new ArrayList<>(runs);
        while (!result.isEmpty()) {
            String stripped = result.get(0).text().stripLeading();
            if (!stripped.isEmpty()) {
                result.set(0, result.get(0).withText(stripped));
                break;
            }
            result.remove(0);
        }
        while (!result.isEmpty()) {
            int last = result.size() - 1;
            String stripped = result.get(last).text().stripTrailing();
            if (!stripped.isEmpty()) {
                result.set(last, result.get(last).withText(stripped));
                break;
            }
            result.remove(last);
        }
        return result;
    }

    /**
     * Tag-stripped text of a fragment, whitespace collapsed.
     */
    static String extractText(List<MarkupToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (MarkupToken token : tokens) {
            if (token.isText()) {
                sb.append(token.value());
            } else if ("br".equals(token.value())) {
                sb.append(' ');
            }
        }
        return WHITESPACE.matcher(sb).replaceAll(" ").strip();
    }

    /**
     * Index of the close tag matching the open tag at {@code start}, counting nested
     * opens of the same name; -1 when the block is never closed.
     */
    static int findClose(List<MarkupToken> tokens, int start, int limit, String tag) {
        int depth = 0;
        for (int i = start; i < limit; i++) {
            MarkupToken token = tokens.get(i);
            if (token.isOpen(tag)) {
                depth++;
            } else if (token.isClose(tag)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private record OpenMark(String tag, Mark mark) {}
}
