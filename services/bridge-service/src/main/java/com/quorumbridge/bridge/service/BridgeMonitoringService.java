package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.BridgeTransactionStatus;
import com.quorumbridge.bridge.dto.ChainStatisticsResponse;
import com.quorumbridge.bridge.repository.BridgeTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Operator view of bridge traffic: per-chain breakdown, settlement speed and transfers
 * that have been pending for too long.
 */
@Service
@RequiredArgsConstructor
public class BridgeMonitoringService {

    private final BridgeTransactionRepository transactionRepository;
    private final BridgeProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ChainStatisticsResponse> chainStatistics() {
        Map<Long, ChainStatisticsResponse> byChain = new TreeMap<>();
        for (Object[] row : transactionRepository.getStatisticsByDestinationChainAndStatus()) {
            Long chainId = ((Number) row[0]).longValue();
            BridgeTransactionStatus status = (BridgeTransactionStatus) row[1];
            long count = ((Number) row[2]).longValue();

            ChainStatisticsResponse chain = byChain.computeIfAbsent(chainId, id -> ChainStatisticsResponse.builder()
                    .chainId(id)
                    .volume(BigInteger.ZERO)
                    .fees(BigInteger.ZERO)
                    .build());
            chain.setTransactions(chain.getTransactions() + count);
            chain.setVolume(chain.getVolume().add(toBigInteger(row[3])));
            chain.setFees(chain.getFees().add(toBigInteger(row[4])));
            switch (status) {
                case COMPLETED -> {
                    chain.setCompleted(count);
                    chain.setAverageCompletionSeconds(row[5] == null ? null : ((Number) row[5]).doubleValue() / 1000.0);
                }
                case FAILED -> chain.setFailed(count);
                case CANCELLED -> chain.setCancelled(count);
                case PENDING -> chain.setPending(count);
            }
        }
        List<ChainStatisticsResponse> chains = new ArrayList<>(byChain.values());
        chains.forEach(c -> c.setSuccessRate(successRate(c.getCompleted(), c.getFailed() + c.getCancelled())));
        return chains;
    }

    /**
     * Percentage of finished transfers that completed; zero when none has finished.
     */
    public double successRate(long completed, long unsuccessful) {
        long finished = completed + unsuccessful;
        return finished == 0 ? 0.0 : completed * 100.0 / finished;
    }

    @Transactional(readOnly = true)
    public Double averageCompletionSeconds() {
        Double millis = transactionRepository.averageCompletionMillis();
        return millis == null ? null : millis / 1000.0;
    }

    /**
     * Pending transfers initiated at least {@code bridge.monitoring.stuck-after} ago, oldest first.
     */
    @Transactional(readOnly = true)
    public List<BridgeTransaction> listStuckTransactions() {
        return transactionRepository.findByStatusAndCreatedAtLessThanEqualOrderByCreatedAtAsc(
                BridgeTransactionStatus.PENDING, stuckCutoff());
    }

    @Transactional(readOnly = true)
    public long countStuckTransactions() {
        return transactionRepository.countByStatusAndCreatedAtLessThanEqual(
                BridgeTransactionStatus.PENDING, stuckCutoff());
    }

    private Instant stuckCutoff() {
        return clock.instant().minus(properties.getMonitoring().getStuckAfter());
    }

    private static BigInteger toBigInteger(Object value) {
        if (value == null) {
            return BigInteger.ZERO;
        }
        if (value instanceof BigInteger big) {
            return big;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toBigIntegerExact();
        }
        return BigInteger.valueOf(((Number) value).longValue());
    }
}
