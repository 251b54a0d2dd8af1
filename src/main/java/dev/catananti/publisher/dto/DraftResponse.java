package dev.catananti.publisher.dto;

import dev.catananti.publisher.model.DraftRecord;
import lombok.Builder;

import java.util.List;

@Builder
public record DraftResponse(
        long id,
        String title,
        String subtitle,
        Long categoryId,
        String coverImage,
        List<String> tags,
        boolean published,
        String slug,
        String canonicalUrl,
        int blockCount,
        String plainText
) {

    public static DraftResponse fromRecord(DraftRecord draft) {
        return DraftResponse.builder()
                .id(draft.id())
                .title(draft.title())
                .subtitle(draft.subtitle())
                .categoryId(draft.categoryId())
                .coverImage(draft.coverAssetUrl())
                .tags(draft.tags())
                .published(draft.published())
                .slug(draft.slug())
                .canonicalUrl(draft.canonicalUrl())
                .blockCount(draft.document().size())
                .plainText(draft.document().plainText())
                .build();
    }
}
