package dev.catananti.publisher.exception;

import dev.catananti.publisher.model.DraftRecord;
import dev.catananti.publisher.model.PublishStage;

import java.util.Optional;

/**
 * Base of all publish failures. Carries the draft as far as it got, when one exists,
 * so callers can delete it or resume on the same id instead of creating a duplicate.
 */
public class PublishPipelineException extends RuntimeException {

    private final PublishStage stage;
    private final DraftRecord draft;

    public PublishPipelineException(String message, PublishStage stage, DraftRecord draft) {
        super(message);
        this.stage = stage;
        this.draft = draft;
    }

    public PublishPipelineException(String message, PublishStage stage, DraftRecord draft, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.draft = draft;
    }

    public PublishStage getStage() {
        return stage;
    }

    public Optional<DraftRecord> getDraft() {
        return Optional.ofNullable(draft);
    }
}
