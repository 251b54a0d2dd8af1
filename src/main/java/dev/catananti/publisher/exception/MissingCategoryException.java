package dev.catananti.publisher.exception;

/**
 * The platform refuses to publish a draft without a section. Raised before any remote call.
 */
public class MissingCategoryException extends PublishPipelineException {

    public MissingCategoryException() {
        super("A category (section) is required to publish; set one on the request or configure publisher.default-section-id",
                null, null);
    }
}
