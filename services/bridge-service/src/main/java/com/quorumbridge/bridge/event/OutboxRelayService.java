package com.quorumbridge.bridge.event;

import com.quorumbridge.bridge.domain.BridgeEventOutbox;
import com.quorumbridge.bridge.domain.BridgeEventOutbox.OutboxStatus;
import com.quorumbridge.bridge.repository.BridgeEventOutboxRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays committed outbox events to Kafka, retrying failed sends with exponential backoff.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OutboxRelayService {

    private static final int BATCH_SIZE = 100;
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final BridgeEventOutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${bridge.outbox.enabled:true}")
    private boolean relayEnabled = true;

    /**
     * Process outbox queue every 5 seconds
     */
    @Scheduled(fixedDelayString = "${bridge.outbox.relay-interval-ms:5000}")
    @Transactional
    public void relayPendingEvents() {
        if (!relayEnabled) {
            log.debug("Outbox relay disabled. Skipping.");
            return;
        }

        List<BridgeEventOutbox> pending = outboxRepository
                .findEventsReadyToSend(clock.instant(), PageRequest.of(0, BATCH_SIZE));
        if (pending.isEmpty()) {
            return;
        }

        log.info("Relaying {} bridge events", pending.size());
        int successCount = 0;
        int failureCount = 0;

        for (BridgeEventOutbox event : pending) {
            if (send(event)) {
                successCount++;
            } else {
                failureCount++;
            }
        }

        log.info("Outbox relay completed. Success: {}, Failures: {}", successCount, failureCount);
        meterRegistry.counter("bridge.outbox.relayed", "result", "success").increment(successCount);
        meterRegistry.counter("bridge.outbox.relayed", "result", "failure").increment(failureCount);
    }

    boolean send(BridgeEventOutbox event) {
        try {
            kafkaTemplate.send(event.getTopic(), event.getEventKey(), event.getPayload())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            event.setStatus(OutboxStatus.SENT);
            event.setSentAt(clock.instant());
            event.setErrorMessage(null);
            outboxRepository.save(event);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handleFailure(event, e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            handleFailure(event, e);
        }
        return false;
    }

    private void handleFailure(BridgeEventOutbox event, Exception e) {
        event.setErrorMessage(e.getMessage());
        if (event.incrementRetryCount(clock.instant())) {
            log.warn("Failed to relay event {} ({}), retry {} scheduled at {}",
                    event.getId(), event.getEventType(), event.getRetryCount(), event.getNextRetryAt());
        } else {
            log.error("Event {} ({}) permanently failed after {} attempts",
                    event.getId(), event.getEventType(), event.getRetryCount(), e);
        }
        outboxRepository.save(event);
    }
}
