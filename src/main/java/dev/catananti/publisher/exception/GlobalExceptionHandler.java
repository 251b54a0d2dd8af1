package dev.catananti.publisher.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final Pattern PACKAGE_REF = Pattern.compile("([a-z]+\\.)+[A-Z][a-zA-Z0-9]+");
    private static final int MAX_MESSAGE_LENGTH = 200;

    @ExceptionHandler(MissingCategoryException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleMissingCategory(MissingCategoryException ex, ServerWebExchange exchange) {
        log.warn("Publish refused: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, exchange));
    }

    @ExceptionHandler(InvalidPublishRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleInvalidRequest(InvalidPublishRequestException ex, ServerWebExchange exchange) {
        log.warn("Invalid publish request: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, exchange));
    }

    @ExceptionHandler(DraftAlreadyPublishedException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleAlreadyPublished(DraftAlreadyPublishedException ex, ServerWebExchange exchange) {
        log.warn("Draft already published: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.CONFLICT, ex.getMessage(), ex, exchange));
    }

    @ExceptionHandler(AssetUploadFailedException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Mono<ErrorResponse> handleAssetUpload(AssetUploadFailedException ex, ServerWebExchange exchange) {
        log.warn("Asset upload failed: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.UNPROCESSABLE_ENTITY, sanitize(ex.getMessage()), ex, exchange));
    }

    @ExceptionHandler(RemoteRejectedException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Mono<ErrorResponse> handleRemoteRejected(RemoteRejectedException ex, ServerWebExchange exchange) {
        log.error("Platform rejected {} (status {}): {}",
                ex.getStage().getDisplayName(), ex.getStatus(), ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_GATEWAY, sanitize(ex.getMessage()), ex, exchange));
    }

    @ExceptionHandler(PublishPipelineException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Mono<ErrorResponse> handlePipelineFailure(PublishPipelineException ex, ServerWebExchange exchange) {
        log.error("Publish pipeline failed: {}", ex.getMessage(), ex);
        return Mono.just(build(HttpStatus.BAD_GATEWAY, sanitize(ex.getMessage()), ex, exchange));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toUnmodifiableMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "Invalid value",
                        (existing, ignored) -> existing
                ));

        log.warn("Validation failed: {}", errors);
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
                .message("Invalid request data")
                .path(exchange.getRequest().getPath().value())
                .validationErrors(errors)
                .build());
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleBadInput(Exception ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
                .message(sanitize(ex.getMessage()))
                .path(exchange.getRequest().getPath().value())
                .build());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase())
                .message("An unexpected error occurred")
                .path(exchange.getRequest().getPath().value())
                .build());
    }

    private ErrorResponse build(HttpStatus status, String message, PublishPipelineException ex, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .stage(ex.getStage() != null ? ex.getStage().getDisplayName() : null)
                .draftId(ex.getDraft().map(draft -> draft.id()).orElse(null))
                .build();
    }

    /**
     * Platform error bodies are echoed into messages; keep them short and free of class names.
     */
    static String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return "Request failed";
        }
        String sanitized = PACKAGE_REF.matcher(message).replaceAll("[class]");
        if (sanitized.length() > MAX_MESSAGE_LENGTH) {
            sanitized = sanitized.substring(0, MAX_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
