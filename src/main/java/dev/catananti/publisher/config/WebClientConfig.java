package dev.catananti.publisher.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration(proxyBeanMethods = false)
public class WebClientConfig {

    /**
     * Draft and post responses echo the full body, so the default 256KB buffer is too small.
     */
    @Bean
    public WebClient.Builder webClientBuilder(
            @Value("${publisher.http.max-in-memory-size:16MB}") DataSize maxInMemorySize) {
        return WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize((int) maxInMemorySize.toBytes()));
    }
}
