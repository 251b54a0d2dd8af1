package dev.catananti.publisher.exception;

import dev.catananti.publisher.model.PublishStage;

public class AssetUploadFailedException extends PublishPipelineException {

    public AssetUploadFailedException(String message) {
        super(message, PublishStage.UPLOAD_ASSET, null);
    }

    public AssetUploadFailedException(String message, Throwable cause) {
        super(message, PublishStage.UPLOAD_ASSET, null, cause);
    }
}
