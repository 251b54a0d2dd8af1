package dev.catananti.publisher.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import dev.catananti.publisher.service.transport.TransportException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Timeout and circuit-breaker settings for calls to the publishing platform.
 * Retries are deliberately absent: draft creation and publish are not idempotent.
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration externalTimeout;
    private final float failureRateThreshold;
    private final Duration waitInOpenState;
    private final int slidingWindowSize;

    public ResilienceConfig(
            @Value("${resilience.external.timeout-seconds:30}") int externalTimeoutSeconds,
            @Value("${resilience.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${resilience.circuit-breaker.wait-open-seconds:60}") int waitOpenSeconds,
            @Value("${resilience.circuit-breaker.sliding-window-size:10}") int slidingWindowSize
    ) {
        this.externalTimeout = Duration.ofSeconds(externalTimeoutSeconds);
        this.failureRateThreshold = failureRateThreshold;
        this.waitInOpenState = Duration.ofSeconds(waitOpenSeconds);
        this.slidingWindowSize = slidingWindowSize;
        log.info("Resilience configuration initialized (timeout={}s, failureRate={}%, window={})",
                externalTimeoutSeconds, failureRateThreshold, slidingWindowSize);
    }

    /**
     * Breaker for one platform host. Client errors (4xx) are the caller's fault and do not count as failures.
     */
    public CircuitBreaker platformCircuitBreaker(String name) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(waitInOpenState)
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(slidingWindowSize)
                .recordException(this::isPlatformFailure)
                .build();
        return CircuitBreaker.of(name, config);
    }

    private boolean isPlatformFailure(Throwable throwable) {
        if (throwable instanceof TransportException transportException) {
            return transportException.isServerSide();
        }
        return true;
    }
}
