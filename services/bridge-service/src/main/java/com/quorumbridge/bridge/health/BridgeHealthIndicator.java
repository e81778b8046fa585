package com.quorumbridge.bridge.health;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.domain.BridgeEventOutbox.OutboxStatus;
import com.quorumbridge.bridge.repository.BridgeEventOutboxRepository;
import com.quorumbridge.bridge.service.BridgeMonitoringService;
import com.quorumbridge.bridge.service.ValidatorRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Health indicator for the bridge policy layer.
 *
 * <p>DOWN when fewer active validators remain than the attestation threshold, since no
 * transfer can complete. DEGRADED when transfers are stuck pending or outbox events
 * have permanently failed.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BridgeHealthIndicator implements HealthIndicator {

    public static final String DEGRADED = "DEGRADED";

    private final ValidatorRegistryService validatorRegistry;
    private final BridgeMonitoringService monitoringService;
    private final BridgeEventOutboxRepository outboxRepository;
    private final BridgeProperties properties;

    @Override
    public Health health() {
        try {
            long activeValidators = validatorRegistry.activeCount();
            int threshold = properties.getAttestation().getThreshold();
            long stuck = monitoringService.countStuckTransactions();
            long failedEvents = outboxRepository.countByStatus(OutboxStatus.FAILED);
            long backlog = outboxRepository.countByStatus(OutboxStatus.PENDING)
                    + outboxRepository.countByStatus(OutboxStatus.RETRY_SCHEDULED);

            List<String> issues = new ArrayList<>();
            Health.Builder healthBuilder;
            if (activeValidators < threshold) {
                issues.add(activeValidators + " active validators, " + threshold + " needed for quorum");
                healthBuilder = Health.down();
            } else {
                healthBuilder = Health.up();
            }
            if (stuck > 0) {
                issues.add(stuck + " transactions pending for over " + properties.getMonitoring().getStuckAfter());
            }
            if (failedEvents > 0) {
                issues.add(failedEvents + " outbox events failed permanently");
            }
            if (activeValidators >= threshold && !issues.isEmpty()) {
                healthBuilder = Health.status(DEGRADED);
            }

            return healthBuilder
                    .withDetail("activeValidators", activeValidators)
                    .withDetail("attestationThreshold", threshold)
                    .withDetail("stuckTransactions", stuck)
                    .withDetail("outboxBacklog", backlog)
                    .withDetail("failedOutboxEvents", failedEvents)
                    .withDetail("issues", issues)
                    .build();
        } catch (Exception e) {
            log.error("Bridge health check failed", e);
            return Health.down(e).build();
        }
    }
}
