package com.quorumbridge.bridge.client;

import com.quorumbridge.bridge.client.dto.BalanceResponse;
import com.quorumbridge.bridge.client.dto.TransferRequest;
import com.quorumbridge.bridge.client.dto.TransferResult;
import com.quorumbridge.bridge.exception.BridgeException;
import com.quorumbridge.bridge.exception.EconomicException;
import com.quorumbridge.bridge.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.openfeign.FallbackFactory;
import org.springframework.stereotype.Component;

/**
 * Fallback for the token ledger client.
 *
 * <p>Funds never move without ledger confirmation, so every fallback path raises.
 * Errors already decoded into bridge exceptions are rethrown unchanged.</p>
 */
@Slf4j
@Component
public class TokenLedgerClientFallbackFactory implements FallbackFactory<TokenLedgerClient> {

    @Override
    public TokenLedgerClient create(Throwable cause) {
        return new TokenLedgerClientFallback(cause);
    }

    @Slf4j
    @RequiredArgsConstructor
    static class TokenLedgerClientFallback implements TokenLedgerClient {

        private final Throwable cause;

        @Override
        public BalanceResponse balanceOf(String address) {
            log.warn("FALLBACK ACTIVATED: token ledger unavailable for balance inquiry - address: {}", address);
            throw unavailable("balanceOf");
        }

        @Override
        public TransferResult transfer(TransferRequest request) {
            log.error("FALLBACK ACTIVATED: BLOCKING transfer - to: {}, amount: {}, reference: {}",
                    request.getTo(), request.getAmount(), request.getReference());
            throw unavailable("transfer");
        }

        @Override
        public TransferResult transferFrom(TransferRequest request) {
            log.error("FALLBACK ACTIVATED: BLOCKING transferFrom - from: {}, amount: {}, reference: {}",
                    request.getFrom(), request.getAmount(), request.getReference());
            throw unavailable("transferFrom");
        }

        private BridgeException unavailable(String operation) {
            if (cause instanceof BridgeException bridgeException) {
                return bridgeException;
            }
            return new EconomicException(ErrorCode.TOKEN_LEDGER_UNAVAILABLE,
                    "Token ledger unavailable for " + operation, true, cause);
        }
    }
}
