package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.crypto.Addresses;
import com.quorumbridge.bridge.crypto.TokenAmounts;
import com.quorumbridge.bridge.domain.ChallengeStatus;
import com.quorumbridge.bridge.domain.Validator;
import com.quorumbridge.bridge.event.BridgeEventPublisher;
import com.quorumbridge.bridge.event.BridgeEventType;
import com.quorumbridge.bridge.exception.AuthorizationException;
import com.quorumbridge.bridge.exception.BridgeStateException;
import com.quorumbridge.bridge.exception.EconomicException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ResourceNotFoundException;
import com.quorumbridge.bridge.repository.ChallengeRepository;
import com.quorumbridge.bridge.repository.ValidatorRepository;
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
import java.util.Map;

/**
 * Validator set management: registration, removal, stake custody and reputation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ValidatorRegistryService {

    private final ValidatorRepository validatorRepository;
    private final ChallengeRepository challengeRepository;
    private final ReputationPolicy reputationPolicy;
    private final TokenLedger tokenLedger;
    private final AccessControl accessControl;
    private final BridgeEventPublisher eventPublisher;
    private final BridgeProperties properties;
    private final Clock clock;

    /**
     * Registers a validator and pulls its stake into custody.
     *
     * <p>Checks run in a fixed order: address, existing registration, capacity, stake.
     * A previously removed validator keeps its history and re-enters with at most the
     * neutral reputation.</p>
     */
    @Transactional
    public Validator addValidator(String caller, String address, BigInteger stake) {
        accessControl.requireOwner(caller);
        String normalized = Addresses.normalize(address);
        BridgeProperties.ValidatorProperties config = properties.getValidator();

        Validator existing = validatorRepository.findByAddressForUpdate(normalized).orElse(null);
        if (existing != null && existing.isActive()) {
            throw new BridgeStateException(ErrorCode.ALREADY_REGISTERED, "Validator already registered: " + normalized);
        }
        if (existing != null && existing.getSlashCount() >= config.getMaxSlashCount()) {
            throw new AuthorizationException(ErrorCode.VALIDATOR_BANNED,
                    "Validator " + normalized + " was deactivated after " + existing.getSlashCount() + " slashes");
        }
        if (validatorRepository.countByActiveTrue() >= config.getMaxActiveValidators()) {
            throw new BridgeStateException(ErrorCode.CAPACITY_EXCEEDED,
                    "Active validator set is full (" + config.getMaxActiveValidators() + ")");
        }
        if (stake == null || stake.compareTo(config.getMinStake()) < 0) {
            throw new EconomicException(ErrorCode.INSUFFICIENT_STAKE,
                    "Stake " + stake + " below minimum " + config.getMinStake());
        }
        TokenAmounts.requireUint256(stake);

        Instant now = clock.instant();
        tokenLedger.pullIntoCustody(normalized, stake, "validator-stake:" + normalized);

        Validator validator;
        if (existing == null) {
            validator = Validator.builder()
                    .address(normalized)
                    .stake(stake)
                    .reputation(config.getInitialReputation())
                    .active(true)
                    .slashCount(0)
                    .validatedTransactions(0L)
                    .lastActivityAt(now)
                    .registeredAt(now)
                    .build();
        } else {
            validator = existing;
            int carried = reputationPolicy.effectiveReputation(existing, now);
            validator.setStake(TokenAmounts.add(existing.getStake(), stake));
            validator.setReputation(Math.min(carried, config.getInitialReputation()));
            validator.setLastActivityAt(now);
            validator.setActive(true);
            validator.setRegisteredAt(now);
            validator.setDeactivatedAt(null);
            validator.setDeactivationReason(null);
        }
        validator = validatorRepository.save(validator);

        eventPublisher.validatorEvent(BridgeEventType.VALIDATOR_ADDED, validator,
                Map.of("stakeDeposited", BridgeEventPublisher.amount(stake)));
        log.info("Validator {} registered with stake {} and reputation {}",
                normalized, validator.getStake(), validator.getReputation());
        return validator;
    }

    /**
     * Deactivates a validator. Its stake goes back once no challenge against it is open.
     */
    @Transactional
    public Validator removeValidator(String caller, String address, String reason) {
        accessControl.requireOwner(caller);
        String normalized = Addresses.normalize(address);
        String why = reason == null || reason.isBlank() ? "removed by owner" : reason;

        Validator validator = validatorRepository.findByAddressForUpdate(normalized)
                .filter(Validator::isActive)
                .orElseThrow(() -> new BridgeStateException(ErrorCode.NOT_REGISTERED,
                        "No active validator " + normalized));
        long active = validatorRepository.countByActiveTrue();
        if (active - 1 < properties.getValidator().getMinActiveValidators()) {
            throw new BridgeStateException(ErrorCode.BELOW_QUORUM_THRESHOLD,
                    "Removing " + normalized + " would leave " + (active - 1) + " active validators, minimum is "
                            + properties.getValidator().getMinActiveValidators());
        }

        validator.deactivate(why, clock.instant());
        validatorRepository.save(validator);
        eventPublisher.validatorEvent(BridgeEventType.VALIDATOR_REMOVED, validator, Map.of("reason", why));
        log.info("Validator {} removed: {}", normalized, why);

        releaseSettledStake(validator);
        return validator;
    }

    /**
     * Returns the remaining stake of an inactive validator with no open challenges.
     *
     * @return the amount released, zero when nothing was due
     */
    @Transactional
    public BigInteger releaseSettledStake(Validator validator) {
        if (validator.isActive() || validator.getStake().signum() == 0) {
            return BigInteger.ZERO;
        }
        long open = challengeRepository.countByValidatorAddressAndStatus(validator.getAddress(), ChallengeStatus.OPEN);
        if (open > 0) {
            log.info("Holding stake {} of {} until {} open challenges are resolved",
                    validator.getStake(), validator.getAddress(), open);
            return BigInteger.ZERO;
        }
        BigInteger released = validator.getStake();
        validator.setStake(BigInteger.ZERO);
        validatorRepository.save(validator);
        tokenLedger.payOut(validator.getAddress(), released, "validator-stake-release:" + validator.getAddress());
        eventPublisher.validatorEvent(BridgeEventType.VALIDATOR_STAKE_RELEASED, validator,
                Map.of("released", BridgeEventPublisher.amount(released)));
        log.info("Released stake {} to {}", released, validator.getAddress());
        return released;
    }

    /**
     * Applies lazy decay, then {@code delta}, clamped to the reputation scale.
     */
    @Transactional
    public int updateReputation(Validator validator, int delta) {
        int before = validator.getReputation();
        int after = reputationPolicy.apply(validator, delta, clock.instant());
        validatorRepository.save(validator);
        log.debug("Reputation of {} {} -> {} (delta {})", validator.getAddress(), before, after, delta);
        return after;
    }

    /**
     * Credits an accepted attestation: one more validated transaction and the attestation reward.
     */
    @Transactional
    public void recordAttestation(Validator validator) {
        validator.setValidatedTransactions(validator.getValidatedTransactions() + 1);
        updateReputation(validator, properties.getValidator().getAttestationReward());
    }

    /**
     * Applies an upheld challenge: stake deduction, reputation penalty, slash count and
     * automatic deactivation at the configured floors.
     */
    @Transactional
    public void applySlash(Validator validator, BigInteger slashed, Long challengeId) {
        BridgeProperties.ValidatorProperties config = properties.getValidator();
        Instant now = clock.instant();

        validator.setStake(validator.getStake().subtract(slashed).max(BigInteger.ZERO));
        validator.setSlashCount(validator.getSlashCount() + 1);
        int reputation = reputationPolicy.apply(validator, -config.getSlashReputationPenalty(), now);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("challengeId", challengeId);
        payload.put("slashed", BridgeEventPublisher.amount(slashed));
        eventPublisher.validatorEvent(BridgeEventType.VALIDATOR_SLASHED, validator, payload);
        log.warn("Validator {} slashed {} (challenge {}), stake now {}, reputation {}, slashCount {}",
                validator.getAddress(), slashed, challengeId, validator.getStake(), reputation, validator.getSlashCount());

        if (validator.isActive() && (validator.getSlashCount() >= config.getMaxSlashCount()
                || reputation < config.getDeactivationReputationFloor())) {
            String reason = validator.getSlashCount() >= config.getMaxSlashCount()
                    ? "slash count reached " + validator.getSlashCount()
                    : "reputation fell to " + reputation;
            validator.deactivate(reason, now);
            eventPublisher.validatorEvent(BridgeEventType.VALIDATOR_DEACTIVATED, validator, Map.of("reason", reason));
            log.warn("Validator {} automatically deactivated: {}", validator.getAddress(), reason);
        }
        validatorRepository.save(validator);
    }

    /**
     * Locks and returns a validator that may attest right now.
     *
     * @throws AuthorizationException with {@link ErrorCode#NOT_ELIGIBLE_VALIDATOR} otherwise
     */
    @Transactional
    public Validator requireEligibleForUpdate(String address) {
        String normalized = Addresses.normalize(address);
        Validator validator = validatorRepository.findByAddressForUpdate(normalized).orElse(null);
        if (validator == null || !reputationPolicy.isEligible(validator, clock.instant())) {
            throw new AuthorizationException(ErrorCode.NOT_ELIGIBLE_VALIDATOR,
                    normalized + " is not an eligible validator");
        }
        return validator;
    }

    @Transactional(readOnly = true)
    public boolean isEligible(String address) {
        if (!Addresses.isValid(address)) {
            return false;
        }
        Instant now = clock.instant();
        return validatorRepository.findByAddress(Addresses.normalize(address))
                .map(v -> reputationPolicy.isEligible(v, now))
                .orElse(false);
    }

    public boolean isEligible(Validator validator) {
        return reputationPolicy.isEligible(validator, clock.instant());
    }

    public int effectiveReputation(Validator validator) {
        return reputationPolicy.effectiveReputation(validator, clock.instant());
    }

    @Transactional(readOnly = true)
    public long activeCount() {
        return validatorRepository.countByActiveTrue();
    }

    @Transactional(readOnly = true)
    public Validator getValidator(String address) {
        String normalized = Addresses.normalize(address);
        return validatorRepository.findByAddress(normalized)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.VALIDATOR_NOT_FOUND,
                        "Validator not found: " + normalized));
    }

    @Transactional(readOnly = true)
    public List<Validator> listActiveValidators() {
        return validatorRepository.findByActiveTrueOrderByRegisteredAtAsc();
    }

    @Transactional(readOnly = true)
    public Page<Validator> listValidators(Pageable pageable) {
        return validatorRepository.findAll(pageable);
    }
}
