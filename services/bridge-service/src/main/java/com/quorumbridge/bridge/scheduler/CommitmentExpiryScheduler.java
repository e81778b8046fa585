package com.quorumbridge.bridge.scheduler;

import com.quorumbridge.bridge.service.attestation.AttestationLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Scheduled jobs for attestation housekeeping
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CommitmentExpiryScheduler {

    private final AttestationLedger attestationLedger;
    private final Clock clock;

    /**
     * Expire commitments whose reveal deadline has passed
     * Runs every minute
     */
    @Scheduled(cron = "${bridge.scheduler.commitment-expiry-cron:0 * * * * *}")
    public void expireStaleCommitments() {
        try {
            int expired = attestationLedger.expireStaleCommitments(clock.instant());
            if (expired > 0) {
                log.info("Expired {} unrevealed attestation commitments", expired);
            }
        } catch (Exception e) {
            log.error("Error expiring attestation commitments", e);
        }
    }
}
