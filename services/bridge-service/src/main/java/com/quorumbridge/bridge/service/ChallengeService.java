package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.crypto.Addresses;
import com.quorumbridge.bridge.crypto.TokenAmounts;
import com.quorumbridge.bridge.domain.Attestation;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.BridgeTransactionStatus;
import com.quorumbridge.bridge.domain.Challenge;
import com.quorumbridge.bridge.domain.ChallengeStatus;
import com.quorumbridge.bridge.domain.ChallengeVote;
import com.quorumbridge.bridge.domain.ReserveFundType;
import com.quorumbridge.bridge.domain.ResolutionMethod;
import com.quorumbridge.bridge.domain.Validator;
import com.quorumbridge.bridge.dto.OpenChallengeRequest;
import com.quorumbridge.bridge.event.BridgeEventPublisher;
import com.quorumbridge.bridge.event.BridgeEventType;
import com.quorumbridge.bridge.exception.AuthorizationException;
import com.quorumbridge.bridge.exception.BridgeStateException;
import com.quorumbridge.bridge.exception.EconomicException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ResourceNotFoundException;
import com.quorumbridge.bridge.exception.ValidationException;
import com.quorumbridge.bridge.metrics.BridgeMetricsService;
import com.quorumbridge.bridge.repository.BridgeTransactionRepository;
import com.quorumbridge.bridge.repository.ChallengeRepository;
import com.quorumbridge.bridge.repository.ChallengeVoteRepository;
import com.quorumbridge.bridge.repository.ValidatorRepository;
import com.quorumbridge.bridge.service.SlashingCalculator.SlashOutcome;
import com.quorumbridge.bridge.service.attestation.AttestationLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Disputes against validator attestations, resolved by an arbitrator or by a
 * token-weighted community vote, with slashing for upheld challenges.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChallengeService {

    private final ChallengeRepository challengeRepository;
    private final ChallengeVoteRepository voteRepository;
    private final ValidatorRepository validatorRepository;
    private final BridgeTransactionRepository transactionRepository;
    private final AttestationLedger attestationLedger;
    private final ValidatorRegistryService validatorRegistry;
    private final SlashingCalculator slashingCalculator;
    private final ReserveFundService reserveFundService;
    private final TokenLedger tokenLedger;
    private final AccessControl accessControl;
    private final BridgeEventPublisher eventPublisher;
    private final BridgeMetricsService metricsService;
    private final BridgeProperties properties;
    private final Clock clock;

    /**
     * Opens a challenge and takes the challenger's stake into custody.
     */
    @Transactional
    public Challenge openChallenge(String caller, OpenChallengeRequest request) {
        Instant now = clock.instant();
        String challenger = Addresses.normalize(caller);
        String validatorAddress = Addresses.normalize(request.getValidator());
        if (request.getProof() == null || request.getProof().isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_PROOF, "Challenge proof is required");
        }
        if (challenger.equals(validatorAddress)) {
            throw new ValidationException(ErrorCode.SELF_CHALLENGE, "A validator cannot challenge itself");
        }

        Validator validator = validatorRepository.findByAddressForUpdate(validatorAddress)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.VALIDATOR_NOT_FOUND,
                        "Validator not found: " + validatorAddress));
        if (!validator.isActive()) {
            throw new BridgeStateException(ErrorCode.VALIDATOR_NOT_ACTIVE,
                    "Validator " + validatorAddress + " is not active");
        }
        Long nonce = request.getTransactionNonce();
        BridgeTransaction tx = transactionRepository.findById(nonce)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.TRANSACTION_NOT_FOUND,
                        "Bridge transaction not found: " + nonce));
        Attestation attestation = attestationLedger.findAttestation(nonce, validatorAddress)
                .orElseThrow(() -> new ValidationException(ErrorCode.ATTESTATION_NOT_FOUND,
                        validatorAddress + " did not attest transaction " + nonce));
        if (attestation.isInvalidated()
                || challengeRepository.existsByValidatorAddressAndTransactionNonceAndStatus(
                        validatorAddress, nonce, ChallengeStatus.UPHELD)) {
            throw new BridgeStateException(ErrorCode.ATTESTATION_ALREADY_SLASHED,
                    "Attestation of transaction " + nonce + " by " + validatorAddress + " was already slashed");
        }
        if (tx.getStatus() == BridgeTransactionStatus.COMPLETED && tx.getCompletedAt() != null
                && now.isAfter(tx.getCompletedAt().plus(properties.getChallenge().getPostCompletionWindow()))) {
            throw new BridgeStateException(ErrorCode.CHALLENGE_WINDOW_CLOSED,
                    "Transaction " + nonce + " completed too long ago to be challenged");
        }
        if (challengeRepository.existsByValidatorAddressAndTransactionNonceAndStatus(
                validatorAddress, nonce, ChallengeStatus.OPEN)) {
            throw new BridgeStateException(ErrorCode.DUPLICATE_CHALLENGE,
                    "An open challenge already disputes the attestation of transaction " + nonce + " by " + validatorAddress);
        }

        BigInteger stake = properties.getChallenge().getStake();
        tokenLedger.pullIntoCustody(challenger, stake, "challenge-stake:" + challenger);

        Challenge challenge = challengeRepository.save(Challenge.builder()
                .challenger(challenger)
                .validatorAddress(validatorAddress)
                .transactionNonce(nonce)
                .proof(request.getProof())
                .stake(stake)
                .createdAt(now)
                .deadline(now.plus(properties.getChallenge().getPeriod()))
                .status(ChallengeStatus.OPEN)
                .build());

        eventPublisher.challengeEvent(BridgeEventType.CHALLENGE_OPENED, challenge,
                Map.of("stake", BridgeEventPublisher.amount(stake)));
        metricsService.recordChallengeOpened();
        log.info("Challenge {} opened by {} against {} on transaction {}, deadline {}",
                challenge.getId(), challenger, validatorAddress, nonce, challenge.getDeadline());
        return challenge;
    }

    /**
     * Arbitrator decision, allowed once the challenge period has elapsed.
     */
    @Transactional
    public Challenge resolveChallenge(String caller, Long challengeId, boolean successful) {
        accessControl.requireArbitrator(caller);
        Instant now = clock.instant();
        Challenge challenge = lockOpenChallenge(challengeId);
        if (now.isBefore(challenge.getDeadline())) {
            throw new BridgeStateException(ErrorCode.CHALLENGE_PERIOD_ACTIVE,
                    "Challenge " + challengeId + " can be resolved from " + challenge.getDeadline(), true);
        }
        return settle(challenge, successful, ResolutionMethod.ARBITRATOR, Addresses.normalize(caller), now);
    }

    /**
     * Token-weighted vote while the challenge period runs. Weight is the voter's token
     * balance at voting time.
     */
    @Transactional
    public ChallengeVote castVote(String caller, Long challengeId, boolean supportsValidator) {
        Instant now = clock.instant();
        String voter = Addresses.normalize(caller);
        Challenge challenge = lockOpenChallenge(challengeId);
        if (!now.isBefore(challenge.getDeadline())) {
            throw new BridgeStateException(ErrorCode.VOTING_CLOSED,
                    "Voting on challenge " + challengeId + " closed at " + challenge.getDeadline());
        }
        if (voter.equals(challenge.getChallenger()) || voter.equals(challenge.getValidatorAddress())) {
            throw new AuthorizationException(ErrorCode.CONFLICT_OF_INTEREST,
                    "Parties to challenge " + challengeId + " cannot vote on it");
        }
        if (voteRepository.existsByChallengeIdAndVoter(challengeId, voter)) {
            throw new BridgeStateException(ErrorCode.DUPLICATE_VOTE,
                    voter + " already voted on challenge " + challengeId);
        }
        BigInteger weight = tokenLedger.balanceOf(voter);
        if (weight.compareTo(properties.getVote().getMinVotingPower()) < 0) {
            throw new EconomicException(ErrorCode.INSUFFICIENT_VOTING_POWER,
                    "Voting power " + weight + " below minimum " + properties.getVote().getMinVotingPower());
        }

        ChallengeVote vote = voteRepository.save(ChallengeVote.builder()
                .challengeId(challengeId)
                .voter(voter)
                .supportsValidator(supportsValidator)
                .weight(weight)
                .votedAt(now)
                .build());
        if (supportsValidator) {
            challenge.setVotesForValidator(TokenAmounts.add(challenge.getVotesForValidator(), weight));
        } else {
            challenge.setVotesAgainstValidator(TokenAmounts.add(challenge.getVotesAgainstValidator(), weight));
        }
        challengeRepository.save(challenge);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("voter", voter);
        payload.put("supportsValidator", supportsValidator);
        payload.put("weight", BridgeEventPublisher.amount(weight));
        eventPublisher.challengeEvent(BridgeEventType.CHALLENGE_VOTE_CAST, challenge, payload);
        log.info("Vote on challenge {} by {}: {} with weight {}",
                challengeId, voter, supportsValidator ? "for validator" : "against validator", weight);
        return vote;
    }

    /**
     * Settles a challenge by its votes. Allowed after the deadline, or earlier once one
     * side holds a supermajority of enough cast weight. More weight against the
     * validator upholds the challenge; a tie rejects it.
     */
    @Transactional
    public Challenge finalizeByVote(String caller, Long challengeId) {
        Instant now = clock.instant();
        String finalizer = Addresses.normalize(caller);
        Challenge challenge = lockOpenChallenge(challengeId);

        BigInteger total = challenge.totalVoteWeight();
        if (total.signum() == 0) {
            throw new BridgeStateException(ErrorCode.NO_VOTES_CAST, "No votes cast on challenge " + challengeId);
        }
        boolean deadlinePassed = !now.isBefore(challenge.getDeadline());
        if (!deadlinePassed && !hasSupermajority(challenge)) {
            throw new BridgeStateException(ErrorCode.CHALLENGE_PERIOD_ACTIVE,
                    "Challenge " + challengeId + " has no supermajority before " + challenge.getDeadline(), true);
        }
        boolean upheld = challenge.getVotesAgainstValidator().compareTo(challenge.getVotesForValidator()) > 0;
        return settle(challenge, upheld, ResolutionMethod.COMMUNITY_VOTE, finalizer, now);
    }

    boolean hasSupermajority(Challenge challenge) {
        BridgeProperties.VoteProperties config = properties.getVote();
        BigInteger total = challenge.totalVoteWeight();
        if (total.compareTo(config.getMinTotalVoteWeight()) < 0) {
            return false;
        }
        BigInteger leading = challenge.getVotesForValidator().max(challenge.getVotesAgainstValidator());
        return leading.multiply(BigInteger.valueOf(BridgeProperties.BPS_DENOMINATOR))
                .compareTo(total.multiply(BigInteger.valueOf(config.getSupermajorityBps()))) >= 0;
    }

    @Transactional(readOnly = true)
    public Challenge getChallenge(Long challengeId) {
        return challengeRepository.findById(challengeId)
                .orElseThrow(() -> notFound(challengeId));
    }

    @Transactional(readOnly = true)
    public Page<Challenge> listChallenges(ChallengeStatus status, Pageable pageable) {
        return status == null ? challengeRepository.findAll(pageable) : challengeRepository.findByStatus(status, pageable);
    }

    @Transactional(readOnly = true)
    public List<ChallengeVote> listVotes(Long challengeId) {
        getChallenge(challengeId);
        return voteRepository.findByChallengeId(challengeId);
    }

    /**
     * Locks the transaction before the validator, the same order attestations and
     * failure votes take them in.
     */
    private Challenge settle(Challenge challenge, boolean upheld, ResolutionMethod method, String resolvedBy, Instant now) {
        BridgeTransaction tx = transactionRepository.findByNonceForUpdate(challenge.getTransactionNonce())
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.TRANSACTION_NOT_FOUND,
                        "Bridge transaction not found: " + challenge.getTransactionNonce()));
        Validator validator = validatorRepository.findByAddressForUpdate(challenge.getValidatorAddress())
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.VALIDATOR_NOT_FOUND,
                        "Validator not found: " + challenge.getValidatorAddress()));

        Map<String, Object> payload = new LinkedHashMap<>();
        if (upheld) {
            SlashOutcome outcome = slashingCalculator.calculate(validator.getStake());
            validatorRegistry.applySlash(validator, outcome.slashed(), challenge.getId());
            attestationLedger.invalidate(challenge.getTransactionNonce(), validator.getAddress(), now);
            tx.setTrustRevoked(true);
            transactionRepository.save(tx);
            reserveFundService.credit(ReserveFundType.INSURANCE, outcome.insuranceShare());
            tokenLedger.payOut(challenge.getChallenger(), challenge.getStake().add(outcome.challengerReward()),
                    "challenge-payout:" + challenge.getId());

            challenge.setStatus(ChallengeStatus.UPHELD);
            challenge.setSlashedAmount(outcome.slashed());
            challenge.setChallengerReward(outcome.challengerReward());
            challenge.setInsuranceShare(outcome.insuranceShare());
            metricsService.recordSlash(outcome.slashed());
            payload.put("slashed", BridgeEventPublisher.amount(outcome.slashed()));
            payload.put("challengerReward", BridgeEventPublisher.amount(outcome.challengerReward()));
            payload.put("insuranceShare", BridgeEventPublisher.amount(outcome.insuranceShare()));
        } else {
            tokenLedger.payOut(challenge.getChallenger(), challenge.getStake(), "challenge-refund:" + challenge.getId());
            challenge.setStatus(ChallengeStatus.REJECTED);
        }
        challenge.setResolutionMethod(method);
        challenge.setResolvedBy(resolvedBy);
        challenge.setResolvedAt(now);
        challengeRepository.save(challenge);

        payload.put("resolutionMethod", method.name());
        payload.put("resolvedBy", resolvedBy);
        eventPublisher.challengeEvent(BridgeEventType.CHALLENGE_RESOLVED, challenge, payload);
        metricsService.recordChallengeResolved(challenge.getStatus().name().toLowerCase(Locale.ROOT), method.name().toLowerCase(Locale.ROOT));
        log.info("Challenge {} resolved {} by {} ({})", challenge.getId(), challenge.getStatus(), resolvedBy, method);

        validatorRegistry.releaseSettledStake(validator);
        return challenge;
    }

    private Challenge lockOpenChallenge(Long challengeId) {
        Challenge challenge = challengeRepository.findByIdForUpdate(challengeId)
                .orElseThrow(() -> notFound(challengeId));
        if (!challenge.isOpen()) {
            throw new BridgeStateException(ErrorCode.ALREADY_RESOLVED,
                    "Challenge " + challengeId + " was already resolved as " + challenge.getStatus());
        }
        return challenge;
    }

    private static ResourceNotFoundException notFound(Long challengeId) {
        return new ResourceNotFoundException(ErrorCode.CHALLENGE_NOT_FOUND, "Challenge not found: " + challengeId);
    }
}
