package dev.catananti.publisher.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.catananti.publisher.model.PublishResult;
import dev.catananti.publisher.model.ShareNote;

/**
 * Published post plus the outcome of sharing it. {@code noteId}, {@code sharedUrl} and
 * {@code shareError} are omitted when no share was requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublishResponse(
        DraftResponse post,
        Long noteId,
        String sharedUrl,
        String shareError
) {

    public static PublishResponse fromResult(PublishResult result) {
        ShareNote note = result.note();
        return new PublishResponse(
                DraftResponse.fromRecord(result.draft()),
                note != null ? note.id() : null,
                note != null ? note.sharedUrl() : null,
                result.shareFailure() != null ? result.shareFailure().getMessage() : null);
    }
}
