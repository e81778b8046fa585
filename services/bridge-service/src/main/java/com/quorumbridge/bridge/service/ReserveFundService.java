package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.crypto.Addresses;
import com.quorumbridge.bridge.crypto.TokenAmounts;
import com.quorumbridge.bridge.domain.ReserveFund;
import com.quorumbridge.bridge.domain.ReserveFundType;
import com.quorumbridge.bridge.event.BridgeEventPublisher;
import com.quorumbridge.bridge.event.BridgeEventType;
import com.quorumbridge.bridge.exception.EconomicException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.repository.ReserveFundRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insurance fund and fee pool held in custody.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReserveFundService {

    private final ReserveFundRepository reserveFundRepository;
    private final TokenLedger tokenLedger;
    private final AccessControl accessControl;
    private final BridgeEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Credits a fund inside the caller's transaction.
     */
    @Transactional
    public BigInteger credit(ReserveFundType type, BigInteger amount) {
        if (amount.signum() == 0) {
            return balance(type);
        }
        ReserveFund fund = lockOrCreate(type);
        fund.setBalance(TokenAmounts.add(fund.getBalance(), amount));
        fund.setUpdatedAt(clock.instant());
        reserveFundRepository.save(fund);
        log.info("Credited {} to {} fund, balance now {}", amount, type, fund.getBalance());
        return fund.getBalance();
    }

    @Transactional(readOnly = true)
    public BigInteger balance(ReserveFundType type) {
        return reserveFundRepository.findByFundType(type)
                .map(ReserveFund::getBalance)
                .orElse(BigInteger.ZERO);
    }

    /**
     * Owner withdrawal from the fee pool.
     *
     * @return the fee pool balance after the withdrawal
     */
    @Transactional
    public BigInteger withdrawFees(String caller, String recipient, BigInteger amount) {
        accessControl.requireOwner(caller);
        String to = Addresses.normalize(recipient);
        TokenAmounts.requirePositive(amount);

        ReserveFund fund = lockOrCreate(ReserveFundType.FEES);
        if (fund.getBalance().compareTo(amount) < 0) {
            throw new EconomicException(ErrorCode.INSUFFICIENT_FUNDS,
                    "Fee pool holds " + fund.getBalance() + ", requested " + amount);
        }
        fund.setBalance(fund.getBalance().subtract(amount));
        fund.setUpdatedAt(clock.instant());
        reserveFundRepository.save(fund);

        tokenLedger.payOut(to, amount, "fee-withdrawal");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recipient", to);
        payload.put("amount", BridgeEventPublisher.amount(amount));
        payload.put("remaining", BridgeEventPublisher.amount(fund.getBalance()));
        eventPublisher.publish(BridgeEventType.FEES_WITHDRAWN, to, payload);

        log.info("Withdrew {} fees to {}, pool balance now {}", amount, to, fund.getBalance());
        return fund.getBalance();
    }

    private ReserveFund lockOrCreate(ReserveFundType type) {
        return reserveFundRepository.findByFundTypeForUpdate(type)
                .orElseGet(() -> reserveFundRepository.save(ReserveFund.builder()
                        .fundType(type)
                        .balance(BigInteger.ZERO)
                        .updatedAt(clock.instant())
                        .build()));
    }
}
