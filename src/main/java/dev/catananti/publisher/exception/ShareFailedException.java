package dev.catananti.publisher.exception;

import dev.catananti.publisher.model.DraftRecord;
import dev.catananti.publisher.model.PublishStage;

/**
 * Sharing failed. The post itself is live and unaffected.
 */
public class ShareFailedException extends PublishPipelineException {

    public ShareFailedException(String message, DraftRecord draft) {
        super(message, PublishStage.SHARE_AS_NOTE, draft);
    }

    public ShareFailedException(String message, DraftRecord draft, Throwable cause) {
        super(message, PublishStage.SHARE_AS_NOTE, draft, cause);
    }
}
