package dev.catananti.publisher.service;

import dev.catananti.publisher.document.ContentDocument;
import dev.catananti.publisher.document.DocumentConverter;
import dev.catananti.publisher.document.Heading;
import dev.catananti.publisher.document.Mark;
import dev.catananti.publisher.document.Paragraph;
import dev.catananti.publisher.document.TextRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownServiceTest {

    private final MarkdownService markdownService = new MarkdownService();

    @Test
    @DisplayName("Should render headings, bold and italic text")
    void shouldRenderBasicMarkdown() {
        String html = markdownService.renderToHtml("## Section\n\nThis is **bold** and *italic* text");

        assertThat(html).contains("<h2>Section</h2>");
        assertThat(html).contains("<strong>bold</strong>");
        assertThat(html).contains("<em>italic</em>");
    }

    @Test
    @DisplayName("Should render strikethrough as del")
    void shouldRenderStrikethrough() {
        assertThat(markdownService.renderToHtml("~~gone~~")).contains("<del>gone</del>");
    }

    @Test
    @DisplayName("Should autolink bare URLs")
    void shouldAutolink() {
        assertThat(markdownService.renderToHtml("visit https://example.com today"))
                .contains("href=\"https://example.com\"");
    }

    @Test
    @DisplayName("Should escape raw HTML")
    void shouldEscapeRawHtml() {
        String html = markdownService.renderToHtml("<script>alert(1)</script>");

        assertThat(html).doesNotContain("<script>");
    }

    @Test
    @DisplayName("Should return empty string for blank input")
    void shouldHandleBlank() {
        assertThat(markdownService.renderToHtml(null)).isEmpty();
        assertThat(markdownService.renderToHtml("  ")).isEmpty();
    }

    @Test
    @DisplayName("Should produce markup the document converter reads without degrading")
    void shouldFeedConverter() {
        ContentDocument document = new DocumentConverter()
                .convert(markdownService.renderToHtml("## Title\n\nHello **world**\n\n- one\n- two"));

        assertThat(document.blocks()).hasSize(3);
        assertThat(document.blocks().get(0)).isEqualTo(new Heading(2, List.of(TextRun.plain("Title"))));
        assertThat(document.blocks().get(1)).isEqualTo(
                new Paragraph(List.of(TextRun.plain("Hello "), TextRun.of("world", Mark.BOLD))));
    }
}
