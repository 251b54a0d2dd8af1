package dev.catananti.publisher.model;

import dev.catananti.publisher.document.ContentDocument;
import lombok.Builder;

import java.util.List;

/**
 * Client-side view of a remote draft or post.
 * {@code id} is assigned by the platform; {@code published} only ever goes from false to true.
 */
@Builder(toBuilder = true)
public record DraftRecord(
        long id,
        String title,
        String subtitle,
        ContentDocument document,
        Long categoryId,
        String coverAssetUrl,
        List<String> tags,
        SeoFields seo,
        boolean published,
        String slug,
        String canonicalUrl
) {

    public DraftRecord {
        title = title == null ? "" : title;
        subtitle = subtitle == null ? "" : subtitle;
        document = document == null ? ContentDocument.empty() : document;
        coverAssetUrl = coverAssetUrl == null ? "" : coverAssetUrl;
        tags = tags == null ? List.of() : List.copyOf(tags);
        seo = seo == null ? SeoFields.empty() : seo;
    }

    /**
     * A freshly created, empty draft.
     */
    public static DraftRecord created(long id) {
        return DraftRecord.builder().id(id).build();
    }
}
