package com.quorumbridge.bridge.crypto;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ValidationException;

import java.math.BigInteger;

/**
 * Integer token arithmetic bounded to the uint256 range of the token ledger.
 */
public final class TokenAmounts {

    public static final BigInteger UINT256_MAX = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    private static final BigInteger BPS = BigInteger.valueOf(BridgeProperties.BPS_DENOMINATOR);

    private TokenAmounts() {
    }

    public static BigInteger requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
        return requireUint256(amount);
    }

    public static BigInteger requireUint256(BigInteger amount) {
        if (amount.signum() < 0 || amount.compareTo(UINT256_MAX) > 0) {
            throw new ValidationException(ErrorCode.AMOUNT_OVERFLOW, "Amount exceeds uint256 range: " + amount);
        }
        return amount;
    }

    /** {@code a + b}, rejected when the sum leaves the uint256 range. */
    public static BigInteger add(BigInteger a, BigInteger b) {
        return requireUint256(a.add(b));
    }

    /** {@code amount * bps / 10000}, rounded down. */
    public static BigInteger applyBps(BigInteger amount, int bps) {
        return amount.multiply(BigInteger.valueOf(bps)).divide(BPS);
    }
}
