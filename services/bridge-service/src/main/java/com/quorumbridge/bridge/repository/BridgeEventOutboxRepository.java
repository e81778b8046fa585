package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.BridgeEventOutbox;
import com.quorumbridge.bridge.domain.BridgeEventOutbox.OutboxStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface BridgeEventOutboxRepository extends JpaRepository<BridgeEventOutbox, UUID> {

    /**
     * Find events ready to send (PENDING or RETRY_SCHEDULED with retry time passed), oldest first
     */
    @Query("SELECT e FROM BridgeEventOutbox e WHERE " +
            "(e.status = 'PENDING' OR " +
            "(e.status = 'RETRY_SCHEDULED' AND e.nextRetryAt <= :now)) " +
            "ORDER BY e.createdAt ASC")
    List<BridgeEventOutbox> findEventsReadyToSend(@Param("now") Instant now, Pageable pageable);

    List<BridgeEventOutbox> findByEventTypeOrderByCreatedAtAsc(String eventType);

    /**
     * Count events by status
     */
    long countByStatus(OutboxStatus status);
}
