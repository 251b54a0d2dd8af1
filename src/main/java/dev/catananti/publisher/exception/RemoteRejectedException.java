package dev.catananti.publisher.exception;

import dev.catananti.publisher.model.DraftRecord;
import dev.catananti.publisher.model.PublishStage;
import dev.catananti.publisher.service.transport.TransportException;

/**
 * The platform answered a stage's call with a non-2xx status, or the call never completed.
 */
public class RemoteRejectedException extends PublishPipelineException {

    private final int status;

    public RemoteRejectedException(PublishStage stage, TransportException cause) {
        this(stage, null, cause);
    }

    public RemoteRejectedException(PublishStage stage, DraftRecord draft, TransportException cause) {
        super(stage.getDisplayName() + " rejected: " + cause.getMessage(), stage, draft, cause);
        this.status = cause.getStatus();
    }

    /**
     * Same failure, annotated with the draft state the pipeline had reached.
     */
    public RemoteRejectedException withDraft(DraftRecord draft) {
        return new RemoteRejectedException(getStage(), draft, (TransportException) getCause());
    }

    public int getStatus() {
        return status;
    }
}
