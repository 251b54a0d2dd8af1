package dev.catananti.publisher.controller;

import dev.catananti.publisher.dto.DraftResponse;
import dev.catananti.publisher.dto.PublishPostRequest;
import dev.catananti.publisher.dto.PublishResponse;
import dev.catananti.publisher.service.PublishPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/posts")
@RequiredArgsConstructor
@Tag(name = "Posts", description = "Publish posts and share them as notes")
@Slf4j
public class PublishController {

    private final PublishPipeline publishPipeline;

    @PostMapping("/publish")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Publish a post", description = "Create a draft, fill it, publish it and optionally share it as a note")
    public Mono<PublishResponse> publish(@Valid @RequestBody PublishPostRequest request) {
        log.info("Publish requested: title='{}', share={}", request.getTitle(), request.getShareText() != null);
        return publishPipeline.publish(request.toPublishRequest())
                .map(PublishResponse::fromResult);
    }

    @PostMapping("/drafts/{draftId}/publish")
    @Operation(summary = "Publish an existing draft", description = "Resume publishing on a draft left behind by an earlier failure")
    public Mono<PublishResponse> publishExisting(@PathVariable long draftId,
                                                 @Valid @RequestBody PublishPostRequest request) {
        log.info("Publish requested for existing draft {}", draftId);
        return publishPipeline.publishExisting(draftId, request.toPublishRequest())
                .map(PublishResponse::fromResult);
    }

    @GetMapping("/drafts/{draftId}")
    @Operation(summary = "Get draft", description = "Fetch a draft or post by id")
    public Mono<DraftResponse> getDraft(@PathVariable long draftId) {
        return publishPipeline.fetchDraft(draftId)
                .map(DraftResponse::fromRecord);
    }

    @DeleteMapping("/drafts/{draftId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete draft", description = "Delete a draft that was never published")
    public Mono<Void> deleteDraft(@PathVariable long draftId) {
        log.info("Delete requested for draft {}", draftId);
        return publishPipeline.discardDraft(draftId);
    }
}
