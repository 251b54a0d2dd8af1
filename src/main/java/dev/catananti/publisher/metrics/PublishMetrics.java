package dev.catananti.publisher.metrics;

import dev.catananti.publisher.model.PublishStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PublishMetrics {

    private final MeterRegistry meterRegistry;

    private Counter publishedCounter;
    private Counter coverDegradedCounter;
    private Counter conversionDegradedCounter;
    private Counter sharedCounter;
    private Counter shareFailedCounter;

    @PostConstruct
    public void init() {
        publishedCounter = Counter.builder("publisher.publish.success")
                .description("Posts published")
                .register(meterRegistry);
        coverDegradedCounter = Counter.builder("publisher.publish.cover.degraded")
                .description("Posts published without their cover because the upload failed")
                .register(meterRegistry);
        conversionDegradedCounter = Counter.builder("publisher.publish.conversion.degraded")
                .description("Markup fragments flattened to plain paragraphs")
                .register(meterRegistry);
        sharedCounter = Counter.builder("publisher.share.success")
                .description("Posts shared as notes")
                .register(meterRegistry);
        shareFailedCounter = Counter.builder("publisher.share.failure")
                .description("Share attempts that failed after a successful publish")
                .register(meterRegistry);
    }

    public void recordPublished() {
        publishedCounter.increment();
    }

    /**
     * Failures are tagged by stage; failures before any remote call use {@code Validation}.
     */
    public void recordFailure(PublishStage stage) {
        meterRegistry.counter("publisher.publish.failure",
                "stage", stage != null ? stage.getDisplayName() : "Validation").increment();
    }

    public void recordCoverDegraded() {
        coverDegradedCounter.increment();
    }

    public void recordConversionDegraded(int fragments) {
        conversionDegradedCounter.increment(fragments);
    }

    public void recordShared() {
        sharedCounter.increment();
    }

    public void recordShareFailed() {
        shareFailedCounter.increment();
    }
}
