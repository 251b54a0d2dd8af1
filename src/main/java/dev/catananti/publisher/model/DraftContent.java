package dev.catananti.publisher.model;

import dev.catananti.publisher.document.ContentDocument;
import lombok.Builder;

import java.util.List;

/**
 * Everything written by one content merge. The platform replaces rather than patches
 * content fields, so every field is sent on every merge.
 */
@Builder
public record DraftContent(
        long draftId,
        String title,
        String subtitle,
        ContentDocument document,
        String coverUrl,
        Long categoryId,
        List<String> tags,
        SeoFields seo,
        PostSettings settings
) {

    public DraftContent {
        document = document == null ? ContentDocument.empty() : document;
        tags = tags == null ? List.of() : List.copyOf(tags);
        seo = seo == null ? SeoFields.empty() : seo;
        settings = settings == null ? PostSettings.defaults() : settings;
    }
}
