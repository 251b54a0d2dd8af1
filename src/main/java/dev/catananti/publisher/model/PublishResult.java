package dev.catananti.publisher.model;

import dev.catananti.publisher.exception.ShareFailedException;

/**
 * Outcome of a successful publish. {@code note} is null when sharing was not requested
 * or failed; in the latter case {@code shareFailure} says why.
 */
public record PublishResult(DraftRecord draft, ShareNote note, ShareFailedException shareFailure) {

    public static PublishResult of(DraftRecord draft) {
        return new PublishResult(draft, null, null);
    }

    public boolean isShared() {
        return note != null;
    }
}
