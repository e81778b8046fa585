package com.quorumbridge.bridge.client;

import com.quorumbridge.bridge.exception.EconomicException;
import com.quorumbridge.bridge.exception.ErrorCode;
import feign.Logger;
import feign.Request;
import feign.Response;
import feign.Retryer;
import feign.codec.ErrorDecoder;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JCircuitBreakerFactory;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JConfigBuilder;
import org.springframework.cloud.client.circuitbreaker.Customizer;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Token ledger client configuration: timeouts, no automatic retries (transfers are
 * not idempotent), circuit breaker and error decoding.
 */
public class TokenLedgerClientConfiguration {

    @Bean
    public Request.Options tokenLedgerRequestOptions() {
        return new Request.Options(
                5, TimeUnit.SECONDS,   // connect
                10, TimeUnit.SECONDS,  // read
                true
        );
    }

    @Bean
    public Retryer tokenLedgerRetryer() {
        return Retryer.NEVER_RETRY;
    }

    @Bean
    public Logger.Level tokenLedgerLoggerLevel() {
        return Logger.Level.BASIC;
    }

    @Bean
    public Customizer<Resilience4JCircuitBreakerFactory> tokenLedgerCircuitBreaker() {
        return factory -> factory.configureDefault(id -> new Resilience4JConfigBuilder(id)
                .circuitBreakerConfig(CircuitBreakerConfig.custom()
                        .failureRateThreshold(50.0f)
                        .waitDurationInOpenState(Duration.ofSeconds(30))
                        .slidingWindowSize(10)
                        .minimumNumberOfCalls(5)
                        .build())
                .timeLimiterConfig(TimeLimiterConfig.custom()
                        .timeoutDuration(Duration.ofSeconds(10))
                        .build())
                .build());
    }

    @Bean
    public ErrorDecoder tokenLedgerErrorDecoder() {
        return new TokenLedgerErrorDecoder();
    }

    /**
     * Client errors mean the ledger refused the transfer; anything else means it could
     * not be reached or failed internally.
     */
    @Slf4j
    public static class TokenLedgerErrorDecoder implements ErrorDecoder {

        @Override
        public Exception decode(String methodKey, Response response) {
            log.error("Token ledger error - method={}, status={}, reason={}",
                    methodKey, response.status(), response.reason());
            if (response.status() >= 400 && response.status() < 500) {
                return new EconomicException(ErrorCode.TOKEN_TRANSFER_FAILED,
                        "Token ledger rejected " + methodKey + " with status " + response.status());
            }
            return new EconomicException(ErrorCode.TOKEN_LEDGER_UNAVAILABLE,
                    "Token ledger failed " + methodKey + " with status " + response.status(), true);
        }
    }
}
