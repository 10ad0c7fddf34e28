package com.kgagent.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * HTTP client configuration shared by the SPARQL endpoints, the LLM and the job service.
 */
@Configuration
@EnableConfigurationProperties(KgAgentProperties.class)
public class HttpClientFactory {

    /**
     * Large result sets from the federation endpoint exceed WebFlux's default 256 KB buffer.
     */
    static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    /**
     * Creates the WebClient used for all outbound calls.
     * <p>
     * Requests answered with HTTP 503 or 429 are retried up to 3 attempts with exponential
     * backoff starting at 500ms. These are endpoint load conditions, not query errors; rejected
     * queries go through the repair pass instead.
     *
     * @return the shared {@link WebClient}.
     */
    @Bean
    public WebClient webClient() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2))
                .retryOnException(e -> e instanceof WebClientResponseException.ServiceUnavailable
                        || e instanceof WebClientResponseException.TooManyRequests)
                .build();

        Retry retry = RetryRegistry.of(config).retry("kg-agent-http");

        return WebClient.builder()
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                        .build())
                .filter((request, next) -> next.exchange(request)
                        .flatMap(response -> isRetryable(response.statusCode())
                                ? response.createException().flatMap(ex -> Mono.<ClientResponse>error(ex))
                                : Mono.just(response))
                        .transform(RetryOperator.of(retry)))
                .build();
    }

    private static boolean isRetryable(HttpStatusCode status) {
        return status.value() == 503 || status.value() == 429;
    }

    @Bean
    public PackCachePolicy packCachePolicy(KgAgentProperties properties) {
        KgAgentProperties.Cache cache = properties.getPacks().getCache();
        return PackCachePolicy.of(cache.getMaxAge(), cache.getMaxEntries());
    }
}
