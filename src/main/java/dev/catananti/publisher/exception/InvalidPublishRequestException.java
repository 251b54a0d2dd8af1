package dev.catananti.publisher.exception;

public class InvalidPublishRequestException extends PublishPipelineException {

    public InvalidPublishRequestException(String message) {
        super(message, null, null);
    }
}
