package dev.catananti.publisher.model;

/**
 * A note created to promote a published post. Fire-and-forget: nothing updates it afterwards.
 */
public record ShareNote(long id, String attachmentId, String sharedUrl, String text) {
}
