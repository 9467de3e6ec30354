package com.autoagent.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Creates the HTTP client shared by all capability providers.
 */
@Configuration
public class HttpClientFactory {

    /**
     * A {@link WebClient} that retries requests answered with HTTP 429 (Too Many Requests) or
     * HTTP 503 (Service Unavailable), with exponential backoff starting at 500ms.
     *
     * @param maxAttempts Total attempts per request, the first one included.
     */
    @Bean
    public WebClient webClient(@Value("${agent.http.max-attempts:3}") int maxAttempts) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2))
                .retryOnException(e -> e instanceof WebClientResponseException.ServiceUnavailable
                        || e instanceof WebClientResponseException.TooManyRequests)
                .build();

        Retry retry = RetryRegistry.of(config).retry("auto-agent-http");

        return WebClient.builder()
                .filter((request, next) -> Mono.defer(() -> next.exchange(request))
                        .flatMap(HttpClientFactory::failOnRetryableStatus)
                        .transform(RetryOperator.of(retry)))
                .build();
    }

    // exchange() does not fail on error statuses, so the retry would never see them.
    private static Mono<ClientResponse> failOnRetryableStatus(ClientResponse response) {
        int status = response.statusCode().value();
        if (status == HttpStatus.TOO_MANY_REQUESTS.value() || status == HttpStatus.SERVICE_UNAVAILABLE.value()) {
            return response.createException().flatMap(Mono::error);
        }
        return Mono.just(response);
    }
}
