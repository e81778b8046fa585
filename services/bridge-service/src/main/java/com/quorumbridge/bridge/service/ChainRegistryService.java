package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.crypto.TokenAmounts;
import com.quorumbridge.bridge.domain.ChainConfiguration;
import com.quorumbridge.bridge.dto.ChainConfigurationRequest;
import com.quorumbridge.bridge.dto.FeeQuoteResponse;
import com.quorumbridge.bridge.event.BridgeEventPublisher;
import com.quorumbridge.bridge.event.BridgeEventType;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ValidationException;
import com.quorumbridge.bridge.repository.ChainConfigurationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Destination chain settings and fee computation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChainRegistryService {

    private final ChainConfigurationRepository chainRepository;
    private final AccessControl accessControl;
    private final BridgeEventPublisher eventPublisher;
    private final BridgeProperties properties;
    private final Clock clock;

    /**
     * Inserts configured chains that are not in the database yet. Existing rows win,
     * so runtime changes survive restarts.
     */
    @Transactional
    public void seed(List<BridgeProperties.ChainProperties> chains) {
        for (BridgeProperties.ChainProperties chain : chains) {
            if (chainRepository.existsById(chain.getChainId())) {
                continue;
            }
            ChainConfiguration entity = ChainConfiguration.builder()
                    .chainId(chain.getChainId())
                    .name(chain.getName())
                    .enabled(chain.isEnabled())
                    .minAmount(chain.getMinAmount())
                    .maxAmount(chain.getMaxAmount())
                    .baseFee(chain.getBaseFee())
                    .feeBps(chain.getFeeBps())
                    .updatedAt(clock.instant())
                    .build();
            validate(entity);
            chainRepository.save(entity);
            log.info("Seeded chain configuration {} ({})", chain.getChainId(), chain.getName());
        }
    }

    @Transactional
    public ChainConfiguration configureChain(String caller, ChainConfigurationRequest request) {
        accessControl.requireOwner(caller);

        ChainConfiguration chain = chainRepository.findById(request.getChainId())
                .orElseGet(() -> ChainConfiguration.builder().chainId(request.getChainId()).build());
        chain.setName(request.getName());
        chain.setEnabled(Boolean.TRUE.equals(request.getEnabled()));
        chain.setMinAmount(request.getMinAmount());
        chain.setMaxAmount(request.getMaxAmount());
        chain.setBaseFee(request.getBaseFee());
        chain.setFeeBps(request.getFeeBps());
        chain.setUpdatedAt(clock.instant());
        validate(chain);
        chain = chainRepository.save(chain);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chainId", chain.getChainId());
        payload.put("name", chain.getName());
        payload.put("enabled", chain.isEnabled());
        payload.put("minAmount", BridgeEventPublisher.amount(chain.getMinAmount()));
        payload.put("maxAmount", BridgeEventPublisher.amount(chain.getMaxAmount()));
        payload.put("baseFee", BridgeEventPublisher.amount(chain.getBaseFee()));
        payload.put("feeBps", chain.getFeeBps());
        eventPublisher.publish(BridgeEventType.CHAIN_CONFIGURED, String.valueOf(chain.getChainId()), payload);

        log.info("Chain {} configured: enabled={}, bounds=[{}, {}], baseFee={}, feeBps={}",
                chain.getChainId(), chain.isEnabled(), chain.getMinAmount(), chain.getMaxAmount(),
                chain.getBaseFee(), chain.getFeeBps());
        return chain;
    }

    /**
     * @throws ValidationException with {@link ErrorCode#UNSUPPORTED_CHAIN} when the chain is
     *         unknown, disabled, or this bridge's own chain
     */
    @Transactional(readOnly = true)
    public ChainConfiguration requireEnabled(Long chainId) {
        if (chainId == null || chainId == properties.getChainId()) {
            throw new ValidationException(ErrorCode.UNSUPPORTED_CHAIN,
                    "Destination chain must differ from source chain " + properties.getChainId());
        }
        return chainRepository.findById(chainId)
                .filter(ChainConfiguration::isEnabled)
                .orElseThrow(() -> new ValidationException(ErrorCode.UNSUPPORTED_CHAIN,
                        "Destination chain " + chainId + " is not supported"));
    }

    /** {@code baseFee + amount * feeBps / 10000}. */
    public BigInteger calculateFee(ChainConfiguration chain, BigInteger amount) {
        return TokenAmounts.add(chain.getBaseFee(), TokenAmounts.applyBps(amount, chain.getFeeBps()));
    }

    public void requireWithinBounds(ChainConfiguration chain, BigInteger amount) {
        if (amount.compareTo(chain.getMinAmount()) < 0 || amount.compareTo(chain.getMaxAmount()) > 0) {
            throw new ValidationException(ErrorCode.AMOUNT_OUT_OF_BOUNDS,
                    "Amount " + amount + " outside [" + chain.getMinAmount() + ", " + chain.getMaxAmount()
                            + "] for chain " + chain.getChainId());
        }
    }

    @Transactional(readOnly = true)
    public FeeQuoteResponse quoteFee(Long destinationChainId, BigInteger amount) {
        TokenAmounts.requirePositive(amount);
        ChainConfiguration chain = requireEnabled(destinationChainId);
        requireWithinBounds(chain, amount);
        BigInteger fee = calculateFee(chain, amount);
        return FeeQuoteResponse.builder()
                .destinationChainId(destinationChainId)
                .amount(amount)
                .fee(fee)
                .totalLocked(TokenAmounts.add(amount, fee))
                .build();
    }

    @Transactional(readOnly = true)
    public List<ChainConfiguration> listChains() {
        return chainRepository.findAll();
    }

    private void validate(ChainConfiguration chain) {
        if (chain.getChainId() == null || chain.getChainId() <= 0 || chain.getChainId() == properties.getChainId()) {
            throw invalid("chain id must be positive and differ from this chain");
        }
        if (chain.getName() == null || chain.getName().isBlank()) {
            throw invalid("name is required");
        }
        if (chain.getMinAmount() == null || chain.getMinAmount().signum() <= 0) {
            throw invalid("minimum amount must be positive");
        }
        if (chain.getMaxAmount() == null || chain.getMaxAmount().compareTo(chain.getMinAmount()) < 0) {
            throw invalid("maximum amount must not be below minimum amount");
        }
        TokenAmounts.requireUint256(chain.getMaxAmount());
        if (chain.getBaseFee() == null || chain.getBaseFee().signum() < 0) {
            throw invalid("base fee must not be negative");
        }
        TokenAmounts.requireUint256(chain.getBaseFee());
        if (chain.getFeeBps() == null || chain.getFeeBps() < 0 || chain.getFeeBps() > BridgeProperties.BPS_DENOMINATOR) {
            throw invalid("fee bps must be within [0, " + BridgeProperties.BPS_DENOMINATOR + "]");
        }
    }

    private static ValidationException invalid(String detail) {
        return new ValidationException(ErrorCode.INVALID_CHAIN_CONFIGURATION, "Invalid chain configuration: " + detail);
    }
}
