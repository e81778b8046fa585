package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.crypto.Addresses;
import com.quorumbridge.bridge.crypto.CanonicalMessage;
import com.quorumbridge.bridge.crypto.TokenAmounts;
import com.quorumbridge.bridge.domain.Attestation;
import com.quorumbridge.bridge.domain.AttestationCommitment;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.BridgeTransactionStatus;
import com.quorumbridge.bridge.domain.ChainConfiguration;
import com.quorumbridge.bridge.domain.FailureVote;
import com.quorumbridge.bridge.domain.ReserveFundType;
import com.quorumbridge.bridge.domain.Validator;
import com.quorumbridge.bridge.dto.BridgeStatisticsResponse;
import com.quorumbridge.bridge.dto.InitiateBridgeRequest;
import com.quorumbridge.bridge.event.BridgeEventPublisher;
import com.quorumbridge.bridge.event.BridgeEventType;
import com.quorumbridge.bridge.exception.AuthorizationException;
import com.quorumbridge.bridge.exception.BridgeStateException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ResourceNotFoundException;
import com.quorumbridge.bridge.exception.ValidationException;
import com.quorumbridge.bridge.metrics.BridgeMetricsService;
import com.quorumbridge.bridge.repository.BridgeTransactionRepository;
import com.quorumbridge.bridge.repository.FailureVoteRepository;
import com.quorumbridge.bridge.service.attestation.AttestationLedger;
import com.quorumbridge.bridge.service.attestation.AttestationSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bridge transaction lifecycle: lock, attest, complete, fail by quorum, cancel after timeout.
 *
 * <p>Every entry point locks the transaction row first, so transitions on one nonce are
 * serialized and a terminal status is never left again.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BridgeTransactionService {

    private final BridgeTransactionRepository transactionRepository;
    private final FailureVoteRepository failureVoteRepository;
    private final AttestationLedger attestationLedger;
    private final ValidatorRegistryService validatorRegistry;
    private final ChainRegistryService chainRegistry;
    private final VolumeLimitService volumeLimitService;
    private final ReserveFundService reserveFundService;
    private final BridgeMonitoringService monitoringService;
    private final TokenLedger tokenLedger;
    private final BridgeEventPublisher eventPublisher;
    private final BridgeMetricsService metricsService;
    private final BridgeProperties properties;
    private final Clock clock;

    /**
     * Locks {@code amount + fee} from the caller and opens a pending transfer.
     */
    @Transactional
    public BridgeTransaction initiate(String caller, InitiateBridgeRequest request) {
        String user = Addresses.normalize(caller);
        BigInteger amount = TokenAmounts.requirePositive(request.getAmount());
        ChainConfiguration chain = chainRegistry.requireEnabled(request.getDestinationChainId());
        chainRegistry.requireWithinBounds(chain, amount);
        BigInteger fee = chainRegistry.calculateFee(chain, amount);
        BigInteger total = TokenAmounts.add(amount, fee);

        Instant now = clock.instant();
        volumeLimitService.consume(user, amount, now);

        BridgeTransaction tx = transactionRepository.save(BridgeTransaction.builder()
                .userAddress(user)
                .amount(amount)
                .fee(fee)
                .sourceChainId(properties.getChainId())
                .destinationChainId(chain.getChainId())
                .status(BridgeTransactionStatus.PENDING)
                .createdAt(now)
                .build());
        tx.setMessageHash(CanonicalMessage.toHex(CanonicalMessage.transferHash(
                tx.getNonce(), user, amount, tx.getSourceChainId(), tx.getDestinationChainId())));
        tx = transactionRepository.save(tx);

        tokenLedger.pullIntoCustody(user, total, "bridge-lock:" + tx.getNonce());

        eventPublisher.transactionEvent(BridgeEventType.BRIDGE_INITIATED, tx);
        metricsService.recordTransferInitiated(chain.getChainId());
        log.info("Bridge transfer {} initiated: user={}, amount={}, fee={}, destination={}",
                tx.getNonce(), user, amount, fee, chain.getChainId());
        return tx;
    }

    /**
     * Records a validator attestation and completes the transfer once enough currently
     * eligible validators have attested.
     */
    @Transactional
    public BridgeTransaction attest(String caller, Long nonce, AttestationSubmission submission) {
        Instant now = clock.instant();
        String validatorAddress = Addresses.normalize(caller);
        BridgeTransaction tx = lockTransaction(nonce);
        requireOpenForAttestation(tx, now);

        Validator validator = validatorRegistry.requireEligibleForUpdate(validatorAddress);
        if (failureVoteRepository.existsByTransactionNonceAndValidatorAddress(nonce, validatorAddress)) {
            throw new BridgeStateException(ErrorCode.CONFLICTING_VOTE,
                    validatorAddress + " already voted to fail transaction " + nonce);
        }

        Attestation attestation = attestationLedger.record(tx, validatorAddress, submission, now);
        tx.setAttestationCount(tx.getAttestationCount() + 1);
        validatorRegistry.recordAttestation(validator);

        eventPublisher.transactionEvent(BridgeEventType.VALIDATOR_SIGNED, tx,
                Map.of("validator", validatorAddress, "mode", attestation.getMode().name()));
        metricsService.recordAttestation(attestation.getMode().name());
        log.info("Transaction {} attested by {} ({} of {})",
                nonce, validatorAddress, tx.getAttestationCount(), properties.getAttestation().getThreshold());

        List<String> attesters = attestationLedger.quorumAttesters(nonce, now);
        if (attesters.size() >= properties.getAttestation().getThreshold()) {
            complete(tx, attesters, now);
        }
        return transactionRepository.save(tx);
    }

    /**
     * First phase of a commit-reveal attestation.
     */
    @Transactional
    public AttestationCommitment commitAttestation(String caller, Long nonce, String commitment) {
        Instant now = clock.instant();
        String validatorAddress = Addresses.normalize(caller);
        BridgeTransaction tx = lockTransaction(nonce);
        requireOpenForAttestation(tx, now);
        validatorRegistry.requireEligibleForUpdate(validatorAddress);
        if (failureVoteRepository.existsByTransactionNonceAndValidatorAddress(nonce, validatorAddress)) {
            throw new BridgeStateException(ErrorCode.CONFLICTING_VOTE,
                    validatorAddress + " already voted to fail transaction " + nonce);
        }

        AttestationCommitment saved = attestationLedger.commit(tx, validatorAddress, commitment, now);
        eventPublisher.transactionEvent(BridgeEventType.ATTESTATION_COMMITTED, tx,
                Map.of("validator", validatorAddress, "revealDeadline", saved.getRevealDeadline().toString()));
        log.info("Validator {} committed to transaction {}, reveal by {}", validatorAddress, nonce, saved.getRevealDeadline());
        return saved;
    }

    /**
     * Casts a failure vote. The transfer fails and is refunded once failure votes from
     * currently eligible validators reach the attestation threshold.
     */
    @Transactional
    public BridgeTransaction markFailed(String caller, Long nonce, String reason) {
        Instant now = clock.instant();
        String validatorAddress = Addresses.normalize(caller);
        if (reason == null || reason.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_REASON, "Failure reason is required");
        }
        BridgeTransaction tx = lockTransaction(nonce);
        requirePending(tx);

        validatorRegistry.requireEligibleForUpdate(validatorAddress);
        if (attestationLedger.hasAttested(nonce, validatorAddress)) {
            throw new BridgeStateException(ErrorCode.CONFLICTING_VOTE,
                    validatorAddress + " already attested transaction " + nonce);
        }
        if (failureVoteRepository.existsByTransactionNonceAndValidatorAddress(nonce, validatorAddress)) {
            throw new BridgeStateException(ErrorCode.DUPLICATE_VOTE,
                    validatorAddress + " already voted to fail transaction " + nonce);
        }

        failureVoteRepository.save(FailureVote.builder()
                .transactionNonce(nonce)
                .validatorAddress(validatorAddress)
                .reason(reason)
                .votedAt(now)
                .build());
        tx.setFailureVoteCount(tx.getFailureVoteCount() + 1);
        eventPublisher.transactionEvent(BridgeEventType.FAILURE_VOTE_CAST, tx,
                Map.of("validator", validatorAddress, "reason", reason));
        log.info("Transaction {} failure vote by {}: {}", nonce, validatorAddress, reason);

        List<String> voters = failureVoteRepository.findByTransactionNonce(nonce).stream()
                .map(FailureVote::getValidatorAddress)
                .toList();
        if (attestationLedger.eligibleAmong(voters, now).size() >= properties.getAttestation().getThreshold()) {
            tx.setStatus(BridgeTransactionStatus.FAILED);
            tx.setFailureReason(reason);
            refund(tx, now);
            eventPublisher.transactionEvent(BridgeEventType.BRIDGE_FAILED, tx, Map.of("reason", reason));
            metricsService.recordTransferFinished("failed");
            log.warn("Transaction {} failed by validator quorum, refunded {} to {}",
                    nonce, tx.lockedTotal(), tx.getUserAddress());
        }
        return transactionRepository.save(tx);
    }

    /**
     * User cancellation after the timeout with the full locked amount refunded.
     */
    @Transactional
    public BridgeTransaction cancel(String caller, Long nonce) {
        Instant now = clock.instant();
        String user = Addresses.normalize(caller);
        BridgeTransaction tx = lockTransaction(nonce);
        if (!Addresses.same(tx.getUserAddress(), user)) {
            throw new AuthorizationException(ErrorCode.NOT_TRANSACTION_OWNER,
                    "Only the initiator may cancel transaction " + nonce);
        }
        requirePending(tx);
        Instant cancellableAt = tx.getCreatedAt().plus(properties.getTransaction().getTimeout());
        if (now.isBefore(cancellableAt)) {
            throw new BridgeStateException(ErrorCode.TIMEOUT_NOT_REACHED,
                    "Transaction " + nonce + " can be cancelled from " + cancellableAt, true);
        }

        tx.setStatus(BridgeTransactionStatus.CANCELLED);
        refund(tx, now);
        eventPublisher.transactionEvent(BridgeEventType.BRIDGE_CANCELLED, tx);
        metricsService.recordTransferFinished("cancelled");
        log.info("Transaction {} cancelled by {}, refunded {}", nonce, user, tx.lockedTotal());
        return transactionRepository.save(tx);
    }

    @Transactional(readOnly = true)
    public BridgeTransaction getTransaction(Long nonce) {
        return transactionRepository.findById(nonce)
                .orElseThrow(() -> notFound(nonce));
    }

    @Transactional(readOnly = true)
    public Page<BridgeTransaction> listTransactions(BridgeTransactionStatus status, String user, Pageable pageable) {
        String normalizedUser = user == null ? null : Addresses.normalize(user);
        if (status != null && normalizedUser != null) {
            return transactionRepository.findByStatusAndUserAddress(status, normalizedUser, pageable);
        }
        if (status != null) {
            return transactionRepository.findByStatus(status, pageable);
        }
        if (normalizedUser != null) {
            return transactionRepository.findByUserAddress(normalizedUser, pageable);
        }
        return transactionRepository.findAll(pageable);
    }

    @Transactional(readOnly = true)
    public List<Attestation> listAttestations(Long nonce) {
        getTransaction(nonce);
        return attestationLedger.listAttestations(nonce);
    }

    @Transactional(readOnly = true)
    public BridgeStatisticsResponse getStatistics() {
        Map<BridgeTransactionStatus, Long> byStatus = new EnumMap<>(BridgeTransactionStatus.class);
        for (BridgeTransactionStatus status : BridgeTransactionStatus.values()) {
            byStatus.put(status, transactionRepository.countByStatus(status));
        }
        BigInteger refunded = orZero(transactionRepository.sumAmountByStatus(BridgeTransactionStatus.FAILED))
                .add(orZero(transactionRepository.sumAmountByStatus(BridgeTransactionStatus.CANCELLED)));
        return BridgeStatisticsResponse.builder()
                .totalLocked(orZero(transactionRepository.sumAmount()))
                .totalReleased(orZero(transactionRepository.sumAmountByStatus(BridgeTransactionStatus.COMPLETED)))
                .totalRefunded(refunded)
                .totalPending(orZero(transactionRepository.sumAmountByStatus(BridgeTransactionStatus.PENDING)))
                .feesCollected(orZero(transactionRepository.sumFeeByStatus(BridgeTransactionStatus.COMPLETED)))
                .feePoolBalance(reserveFundService.balance(ReserveFundType.FEES))
                .insuranceFundBalance(reserveFundService.balance(ReserveFundType.INSURANCE))
                .transactionsByStatus(byStatus)
                .activeValidators(validatorRegistry.activeCount())
                .successRate(monitoringService.successRate(byStatus.get(BridgeTransactionStatus.COMPLETED),
                        byStatus.get(BridgeTransactionStatus.FAILED) + byStatus.get(BridgeTransactionStatus.CANCELLED)))
                .averageCompletionSeconds(monitoringService.averageCompletionSeconds())
                .stuckTransactions(monitoringService.countStuckTransactions())
                .chains(monitoringService.chainStatistics())
                .build();
    }

    private void complete(BridgeTransaction tx, List<String> attesters, Instant now) {
        byte[] proof = CanonicalMessage.destinationProof(CanonicalMessage.fromHex(tx.getMessageHash()), attesters);
        tx.setStatus(BridgeTransactionStatus.COMPLETED);
        tx.setCompletedAt(now);
        tx.setCompletionMillis(Duration.between(tx.getCreatedAt(), now).toMillis());
        tx.setDestinationProofHash(CanonicalMessage.toHex(proof));
        reserveFundService.credit(ReserveFundType.FEES, tx.getFee());

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("attesters", attesters.stream().sorted().toList());
        extra.put("destinationProofHash", tx.getDestinationProofHash());
        eventPublisher.transactionEvent(BridgeEventType.BRIDGE_COMPLETED, tx, extra);
        metricsService.recordTransferFinished("completed");
        log.info("Transaction {} completed with {} attestations, proof {}",
                tx.getNonce(), attesters.size(), tx.getDestinationProofHash());
    }

    private void refund(BridgeTransaction tx, Instant now) {
        tx.setRefundedAt(now);
        tokenLedger.payOut(tx.getUserAddress(), tx.lockedTotal(), "bridge-refund:" + tx.getNonce());
    }

    private BridgeTransaction lockTransaction(Long nonce) {
        return transactionRepository.findByNonceForUpdate(nonce)
                .orElseThrow(() -> notFound(nonce));
    }

    private void requirePending(BridgeTransaction tx) {
        if (!tx.isPending()) {
            throw new BridgeStateException(ErrorCode.TRANSACTION_NOT_PENDING,
                    "Transaction " + tx.getNonce() + " is " + tx.getStatus());
        }
    }

    private void requireOpenForAttestation(BridgeTransaction tx, Instant now) {
        requirePending(tx);
        Instant expiresAt = tx.getCreatedAt().plus(properties.getTransaction().getTimeout());
        if (!now.isBefore(expiresAt)) {
            throw new BridgeStateException(ErrorCode.ATTESTATION_WINDOW_EXPIRED,
                    "Attestation window for transaction " + tx.getNonce() + " closed at " + expiresAt);
        }
    }

    private static ResourceNotFoundException notFound(Long nonce) {
        return new ResourceNotFoundException(ErrorCode.TRANSACTION_NOT_FOUND, "Bridge transaction not found: " + nonce);
    }

    private static BigInteger orZero(BigInteger value) {
        return value == null ? BigInteger.ZERO : value;
    }
}
