package dev.catananti.publisher.service;

import lombok.extern.slf4j.Slf4j;
import org.commonmark.Extension;
import org.commonmark.ext.autolink.AutolinkExtension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Renders Markdown bodies to the HTML subset the document converter reads.
 * Supports GFM strikethrough and autolinks; raw HTML in the source is escaped.
 */
@Service
@Slf4j
public class MarkdownService {

    private final Parser parser;
    private final HtmlRenderer renderer;

    public MarkdownService() {
        List<Extension> extensions = List.of(
                StrikethroughExtension.create(),
                AutolinkExtension.create()
        );

        this.parser = Parser.builder()
                .extensions(extensions)
                .build();

        this.renderer = HtmlRenderer.builder()
                .extensions(extensions)
                .escapeHtml(true)
                .softbreak(" ")
                .build();
    }

    /**
     * Convert Markdown content to HTML.
     *
     * @param markdown The Markdown content to convert
     * @return The rendered HTML, empty for blank input
     */
    public String renderToHtml(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }

        try {
            Node document = parser.parse(markdown);
            return renderer.render(document);
        } catch (RuntimeException e) {
            log.error("Error rendering markdown: {}", e.getMessage());
            return "<p>" + Entities.escape(markdown) + "</p>";
        }
    }
}
