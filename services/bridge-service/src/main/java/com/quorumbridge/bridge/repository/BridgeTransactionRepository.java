package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.BridgeTransactionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface BridgeTransactionRepository extends JpaRepository<BridgeTransaction, Long> {

    /**
     * Find transaction by nonce with pessimistic lock; every lifecycle transition goes through here
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM BridgeTransaction t WHERE t.nonce = :nonce")
    Optional<BridgeTransaction> findByNonceForUpdate(@Param("nonce") Long nonce);

    Page<BridgeTransaction> findByStatus(BridgeTransactionStatus status, Pageable pageable);

    Page<BridgeTransaction> findByUserAddress(String userAddress, Pageable pageable);

    Page<BridgeTransaction> findByStatusAndUserAddress(BridgeTransactionStatus status, String userAddress,
                                                       Pageable pageable);

    long countByStatus(BridgeTransactionStatus status);

    /**
     * Sum of principal over all transactions; null when there are none
     */
    @Query("SELECT SUM(t.amount) FROM BridgeTransaction t")
    BigInteger sumAmount();

    @Query("SELECT SUM(t.fee) FROM BridgeTransaction t")
    BigInteger sumFee();

    @Query("SELECT SUM(t.amount) FROM BridgeTransaction t WHERE t.status = :status")
    BigInteger sumAmountByStatus(@Param("status") BridgeTransactionStatus status);

    @Query("SELECT SUM(t.fee) FROM BridgeTransaction t WHERE t.status = :status")
    BigInteger sumFeeByStatus(@Param("status") BridgeTransactionStatus status);

    /**
     * Average initiation-to-completion time in milliseconds; null when nothing completed
     */
    @Query("SELECT AVG(t.completionMillis) FROM BridgeTransaction t WHERE t.status = 'COMPLETED'")
    Double averageCompletionMillis();

    /**
     * Per destination chain and status: chain id, count, principal, fees, average completion millis
     */
    @Query("SELECT t.destinationChainId, t.status, COUNT(t), SUM(t.amount), SUM(t.fee), AVG(t.completionMillis) " +
            "FROM BridgeTransaction t GROUP BY t.destinationChainId, t.status")
    List<Object[]> getStatisticsByDestinationChainAndStatus();

    /**
     * Transfers still in {@code status} that were initiated at or before {@code cutoff}, oldest first
     */
    List<BridgeTransaction> findByStatusAndCreatedAtLessThanEqualOrderByCreatedAtAsc(
            BridgeTransactionStatus status, Instant cutoff);

    long countByStatusAndCreatedAtLessThanEqual(BridgeTransactionStatus status, Instant cutoff);
}
