package com.quorumbridge.bridge.client;

import com.quorumbridge.bridge.client.dto.TransferRequest;
import com.quorumbridge.bridge.exception.BridgeException;
import com.quorumbridge.bridge.exception.EconomicException;
import com.quorumbridge.bridge.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenLedgerClientFallbackFactory Tests")
class TokenLedgerClientFallbackFactoryTest {

    private final TokenLedgerClientFallbackFactory factory = new TokenLedgerClientFallbackFactory();

    private final TransferRequest request = TransferRequest.builder()
            .from("0x00000000000000000000000000000000000000b1")
            .to("0x00000000000000000000000000000000000000c0")
            .amount(BigInteger.TEN)
            .reference("bridge-lock:1")
            .build();

    @Test
    @DisplayName("Should block transfers as retryable when the ledger is unreachable")
    void shouldBlockTransfersWhenUnreachable() {
        TokenLedgerClient fallback = factory.create(new ConnectException("connection refused"));

        assertThatThrownBy(() -> fallback.transferFrom(request))
                .isInstanceOf(EconomicException.class)
                .satisfies(e -> {
                    BridgeException ex = (BridgeException) e;
                    assertThat(ex.getCode()).isEqualTo(ErrorCode.TOKEN_LEDGER_UNAVAILABLE);
                    assertThat(ex.isRetryable()).isTrue();
                    assertThat(ex.getCause()).isInstanceOf(ConnectException.class);
                });
    }

    @Test
    @DisplayName("Should rethrow decoded ledger rejections unchanged")
    void shouldRethrowDecodedRejection() {
        EconomicException rejected = new EconomicException(ErrorCode.TOKEN_TRANSFER_FAILED, "allowance too low");
        TokenLedgerClient fallback = factory.create(rejected);

        assertThatThrownBy(() -> fallback.transfer(request)).isSameAs(rejected);
        assertThatThrownBy(() -> fallback.balanceOf("0x00000000000000000000000000000000000000b1")).isSameAs(rejected);
    }
}
