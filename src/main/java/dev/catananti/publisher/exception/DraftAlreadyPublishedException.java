package dev.catananti.publisher.exception;

import dev.catananti.publisher.model.DraftRecord;
import dev.catananti.publisher.model.PublishStage;

public class DraftAlreadyPublishedException extends PublishPipelineException {

    public DraftAlreadyPublishedException(DraftRecord draft) {
        super("Draft " + draft.id() + " is already published", PublishStage.PUBLISH, draft);
    }
}
