package com.quorumbridge.bridge.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Prometheus metrics for bridge operations.
 */
@Service
@RequiredArgsConstructor
public class BridgeMetricsService {

    private final MeterRegistry meterRegistry;

    public void recordTransferInitiated(long destinationChainId) {
        Counter.builder("bridge.transfer.initiated")
                .tag("destination", String.valueOf(destinationChainId))
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a transfer reaching a terminal state
     */
    public void recordTransferFinished(String outcome) {
        Counter.builder("bridge.transfer.finished")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordAttestation(String mode) {
        Counter.builder("bridge.attestation.accepted")
                .tag("mode", mode)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an operation rejected with a bridge error
     */
    public void recordRejection(String category, String code) {
        Counter.builder("bridge.operation.rejected")
                .tag("category", category)
                .tag("code", code)
                .register(meterRegistry)
                .increment();
    }

    public void recordChallengeOpened() {
        Counter.builder("bridge.challenge.opened")
                .register(meterRegistry)
                .increment();
    }

    public void recordChallengeResolved(String outcome, String method) {
        Counter.builder("bridge.challenge.resolved")
                .tag("outcome", outcome)
                .tag("method", method)
                .register(meterRegistry)
                .increment();
    }

    public void recordSlash(BigInteger slashedAmount) {
        Counter.builder("bridge.validator.slashed")
                .register(meterRegistry)
                .increment();

        meterRegistry.summary("bridge.validator.slashed.amount")
                .record(slashedAmount.doubleValue());
    }
}
