package dev.catananti.publisher.document;

import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits markup into text and tag tokens in a single left-to-right pass.
 * A {@code <} that starts a tag but never reaches its {@code >} ends tokenizing:
 * the rest of the input becomes one {@link MarkupToken.Kind#RAW_TAIL} token.
 */
final class MarkupTokenizer {

    private static final Pattern TAG_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9]*");
    private static final Pattern HREF = Pattern.compile(
            "(?i)\\bhref\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s\"'>]+))");

    private MarkupTokenizer() {}

    static List<MarkupToken> tokenize(String markup) {
        List<MarkupToken> tokens = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int length = markup.length();
        int i = 0;
        while (i < length) {
            char c = markup.charAt(i);
            if (c == '<' && startsTag(markup, i)) {
                int end = markup.indexOf('>', i + 1);
                int nextOpen = markup.indexOf('<', i + 1);
                if (end < 0 || (nextOpen >= 0 && nextOpen < end)) {
                    flushText(tokens, text);
                    tokens.add(MarkupToken.rawTail(Parser.unescapeEntities(markup.substring(i), false)));
                    return tokens;
                }
                flushText(tokens, text);
                MarkupToken tag = parseTag(markup.substring(i + 1, end));
                if (tag != null) {
                    tokens.add(tag);
                }
                i = end + 1;
                continue;
            }
            text.append(c);
            i++;
        }
        flushText(tokens, text);
        return tokens;
    }

    private static boolean startsTag(String markup, int index) {
        if (index + 1 >= markup.length()) {
            return false;
        }
        char next = markup.charAt(index + 1);
        return Character.isLetter(next) || next == '/' || next == '!';
    }

    /**
     * Returns {@code null} for comments, doctypes and nameless tags, which are dropped.
     */
    private static MarkupToken parseTag(String body) {
        String inner = body.trim();
        if (inner.startsWith("!")) {
            return null;
        }
        boolean closing = inner.startsWith("/");
        if (closing) {
            inner = inner.substring(1).trim();
        }
        boolean selfClosing = !closing && inner.endsWith("/");
        if (selfClosing) {
            inner = inner.substring(0, inner.length() - 1).trim();
        }
        Matcher name = TAG_NAME.matcher(inner);
        if (!name.find()) {
            return null;
        }
        String tagName = name.group().toLowerCase(Locale.ROOT);
        if (closing) {
            return new MarkupToken(MarkupToken.Kind.CLOSE, tagName, null);
        }
        String href = null;
        Matcher hrefMatcher = HREF.matcher(inner.substring(name.end()));
        if (hrefMatcher.find()) {
            href = firstNonNull(hrefMatcher.group(1), hrefMatcher.group(2), hrefMatcher.group(3));
        }
        return new MarkupToken(selfClosing ? MarkupToken.Kind.SELF_CLOSING : MarkupToken.Kind.OPEN, tagName, href);
    }

    private static void flushText(List<MarkupToken> tokens, StringBuilder text) {
        if (text.length() > 0) {
            tokens.add(MarkupToken.text(Parser.unescapeEntities(text.toString(), false)));
            text.setLength(0);
        }
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
