package com.quorumbridge.bridge.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quorumbridge.bridge.domain.BridgeEventOutbox;
import com.quorumbridge.bridge.domain.BridgeEventOutbox.OutboxStatus;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.Challenge;
import com.quorumbridge.bridge.domain.Validator;
import com.quorumbridge.bridge.repository.BridgeEventOutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes bridge events to the outbox inside the caller's transaction.
 *
 * <p>Amounts are serialized as decimal strings so consumers never lose precision.</p>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BridgeEventPublisher {

    private final BridgeEventOutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void transactionEvent(BridgeEventType type, BridgeTransaction tx) {
        transactionEvent(type, tx, Map.of());
    }

    public void transactionEvent(BridgeEventType type, BridgeTransaction tx, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("nonce", tx.getNonce());
        payload.put("user", tx.getUserAddress());
        payload.put("amount", amount(tx.getAmount()));
        payload.put("fee", amount(tx.getFee()));
        payload.put("sourceChainId", tx.getSourceChainId());
        payload.put("destinationChainId", tx.getDestinationChainId());
        payload.put("status", tx.getStatus().name());
        payload.put("attestationCount", tx.getAttestationCount());
        payload.put("messageHash", tx.getMessageHash());
        payload.putAll(extra);
        publish(type, String.valueOf(tx.getNonce()), payload);
    }

    public void validatorEvent(BridgeEventType type, Validator validator, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("validator", validator.getAddress());
        payload.put("stake", amount(validator.getStake()));
        payload.put("reputation", validator.getReputation());
        payload.put("active", validator.isActive());
        payload.put("slashCount", validator.getSlashCount());
        payload.putAll(extra);
        publish(type, validator.getAddress(), payload);
    }

    public void challengeEvent(BridgeEventType type, Challenge challenge, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("challengeId", challenge.getId());
        payload.put("challenger", challenge.getChallenger());
        payload.put("validator", challenge.getValidatorAddress());
        payload.put("nonce", challenge.getTransactionNonce());
        payload.put("status", challenge.getStatus().name());
        payload.put("deadline", challenge.getDeadline().toString());
        payload.putAll(extra);
        publish(type, String.valueOf(challenge.getId()), payload);
    }

    /**
     * Generic entry for events not tied to a single aggregate (fee withdrawals, chain settings).
     */
    public void publish(BridgeEventType type, String key, Map<String, Object> body) {
        Instant now = clock.instant();
        String eventId = UUID.randomUUID().toString();

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("eventId", eventId);
        envelope.put("eventType", type.name());
        envelope.put("occurredAt", now.toString());
        envelope.putAll(body);

        BridgeEventOutbox event = BridgeEventOutbox.builder()
                .topic(type.getTopic())
                .eventKey(key)
                .eventType(type.name())
                .payload(serialize(envelope))
                .status(OutboxStatus.PENDING)
                .createdAt(now)
                .build();
        outboxRepository.save(event);
        log.debug("Queued {} event {} for key {}", type, eventId, key);
    }

    public static String amount(BigInteger value) {
        return value == null ? null : value.toString();
    }

    private String serialize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bridge event payload", e);
        }
    }
}
