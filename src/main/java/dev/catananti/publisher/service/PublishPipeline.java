package dev.catananti.publisher.service;

import dev.catananti.publisher.config.PublisherProperties;
import dev.catananti.publisher.document.ContentDocument;
import dev.catananti.publisher.document.ConversionReport;
import dev.catananti.publisher.document.DocumentConverter;
import dev.catananti.publisher.exception.DraftAlreadyPublishedException;
import dev.catananti.publisher.exception.InvalidPublishRequestException;
import dev.catananti.publisher.exception.MissingCategoryException;
import dev.catananti.publisher.exception.PublishPipelineException;
import dev.catananti.publisher.exception.RemoteRejectedException;
import dev.catananti.publisher.exception.ShareFailedException;
import dev.catananti.publisher.metrics.PublishMetrics;
import dev.catananti.publisher.model.BodyFormat;
import dev.catananti.publisher.model.DraftContent;
import dev.catananti.publisher.model.DraftRecord;
import dev.catananti.publisher.model.PublishRequest;
import dev.catananti.publisher.model.PublishResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Drives one post from request to published, optionally shared, state:
 * create draft, upload cover, convert body, merge content, publish, share.
 * <p>
 * Steps run strictly in sequence. A failure after draft creation carries the draft as far
 * as it got, so the caller can resume on its id or delete it. Cover and share failures are
 * not fatal: the post goes out without a cover, or without a note.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublishPipeline {

    private final DraftGateway draftGateway;
    private final AssetResolver assetResolver;
    private final DocumentConverter documentConverter;
    private final MarkdownService markdownService;
    private final ShareComposer shareComposer;
    private final PublisherProperties properties;
    private final PublishMetrics metrics;

    public Mono<PublishResult> publish(PublishRequest request) {
        return Mono.defer(() -> {
                    Long categoryId = validate(request);
                    return draftGateway.createDraft()
                            .doOnNext(draft -> log.info("Draft {} created for '{}'", draft.id(), request.title()))
                            .flatMap(draft -> populateAndPublish(draft, request, categoryId));
                })
                .flatMap(published -> share(published, request))
                .doOnError(this::recordFailure);
    }

    /**
     * Runs the flow on a draft that already exists, typically one left behind by a failed publish.
     * Refuses drafts that are already live.
     */
    public Mono<PublishResult> publishExisting(long draftId, PublishRequest request) {
        return Mono.defer(() -> {
                    Long categoryId = validate(request);
                    return draftGateway.fetchDraft(draftId)
                            .flatMap(existing -> {
                                if (existing.published()) {
                                    return Mono.error(new DraftAlreadyPublishedException(existing));
                                }
                                log.info("Resuming publish on draft {}", draftId);
                                return populateAndPublish(existing, request, categoryId);
                            });
                })
                .flatMap(published -> share(published, request))
                .doOnError(this::recordFailure);
    }

    /**
     * Deletes a draft that never went live.
     */
    public Mono<Void> discardDraft(long draftId) {
        return draftGateway.fetchDraft(draftId)
                .flatMap(existing -> existing.published()
                        ? Mono.<Void>error(new DraftAlreadyPublishedException(existing))
                        : draftGateway.deleteDraft(draftId));
    }

    public Mono<DraftRecord> fetchDraft(long draftId) {
        return draftGateway.fetchDraft(draftId);
    }

    /**
     * Checks everything that can be checked locally. Runs before any remote call so a bad
     * request never leaves a draft behind.
     *
     * @return the category the post will be filed under
     */
    Long validate(PublishRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new InvalidPublishRequestException("Title is required");
        }
        Long categoryId = request.categoryId() != null ? request.categoryId() : properties.getDefaultSectionId();
        if (categoryId == null) {
            throw new MissingCategoryException();
        }
        return categoryId;
    }

    private Mono<DraftRecord> populateAndPublish(DraftRecord draft, PublishRequest request, Long categoryId) {
        return resolveCover(draft, request)
                .flatMap(coverUrl -> draftGateway.mergeContent(DraftContent.builder()
                                .draftId(draft.id())
                                .title(request.title())
                                .subtitle(request.subtitle())
                                .document(convertBody(request))
                                .coverUrl(coverUrl)
                                .categoryId(categoryId)
                                .tags(request.tags())
                                .seo(request.seo())
                                .settings(request.settings())
                                .build())
                        .onErrorMap(RemoteRejectedException.class, e -> e.withDraft(draft)))
                .doOnNext(merged -> log.info("Content merged into draft {} (section {})", merged.id(), merged.categoryId()))
                .flatMap(merged -> draftGateway.publish(merged.id(), request.sendNotification())
                        .map(published -> merged.toBuilder()
                                .published(true)
                                .slug(published.slug() != null ? published.slug() : merged.slug())
                                .canonicalUrl(published.canonicalUrl() != null ? published.canonicalUrl() : merged.canonicalUrl())
                                .build())
                        .onErrorMap(RemoteRejectedException.class, e -> e.withDraft(merged)))
                .doOnNext(published -> {
                    metrics.recordPublished();
                    log.info("Draft {} published as '{}' (notify subscribers: {})",
                            published.id(), published.slug(), request.sendNotification());
                });
    }

    private Mono<String> resolveCover(DraftRecord draft, PublishRequest request) {
        if (request.coverImage() == null) {
            return Mono.just(draft.coverAssetUrl());
        }
        return assetResolver.resolve(request.coverImage(), draft.id())
                .map(remote -> remote.url())
                .onErrorResume(e -> {
                    log.warn("Cover upload for draft {} failed, publishing without cover: {}", draft.id(), e.getMessage());
                    metrics.recordCoverDegraded();
                    return Mono.just("");
                });
    }

    private ContentDocument convertBody(PublishRequest request) {
        String markup = request.bodyFormat() == BodyFormat.MARKDOWN
                ? markdownService.renderToHtml(request.body())
                : request.body();
        ConversionReport report = documentConverter.convertWithReport(markup);
        if (report.isDegraded()) {
            log.warn("{} body fragment(s) flattened to plain text", report.degradations().size());
            metrics.recordConversionDegraded(report.degradations().size());
        }
        return report.document();
    }

    private Mono<PublishResult> share(DraftRecord published, PublishRequest request) {
        if (!request.wantsShare()) {
            return Mono.just(PublishResult.of(published));
        }
        return shareComposer.shareAsNote(published, request.shareText())
                .map(note -> {
                    metrics.recordShared();
                    return new PublishResult(published, note, null);
                })
                .onErrorResume(e -> {
                    ShareFailedException failure = e instanceof ShareFailedException shareFailed
                            ? shareFailed
                            : new ShareFailedException("Sharing post " + published.id() + " failed: " + e.getMessage(), published, e);
                    log.warn("Post {} is live but sharing failed: {}", published.id(), failure.getMessage());
                    metrics.recordShareFailed();
                    return Mono.just(new PublishResult(published, null, failure));
                });
    }

    private void recordFailure(Throwable e) {
        if (e instanceof PublishPipelineException pipelineException) {
            metrics.recordFailure(pipelineException.getStage());
            log.error("Publish failed at {}: {}", pipelineException.getStage() != null
                    ? pipelineException.getStage().getDisplayName() : "validation", e.getMessage());
        } else {
            log.error("Publish failed: {}", e.getMessage(), e);
        }
    }
}
