package com.quorumbridge.bridge.crypto;

import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ValidationException;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Locale;

/**
 * Recovers signers of 65-byte {@code r ‖ s ‖ v} secp256k1 signatures made over the
 * Ethereum signed-message prefix of a 32-byte hash.
 *
 * <p>Only low-s signatures are accepted, so a signature cannot be re-submitted in its
 * malleated form to get past the replay guard.</p>
 */
public final class SignatureVerifier {

    private static final int SIGNATURE_LENGTH = 65;
    private static final BigInteger HALF_CURVE_ORDER = Sign.CURVE_PARAMS.getN().shiftRight(1);

    private SignatureVerifier() {
    }

    /**
     * @return the lower-case signer address
     * @throws ValidationException with {@link ErrorCode#INVALID_SIGNATURE} when the
     *         signature is malformed or no key can be recovered
     */
    public static String recoverSigner(byte[] hash, String signatureHex) {
        byte[] sig = decode(signatureHex);
        byte v = sig[64];
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw invalid("unsupported recovery id " + sig[64]);
        }
        byte[] r = Arrays.copyOfRange(sig, 0, 32);
        byte[] s = Arrays.copyOfRange(sig, 32, 64);
        if (new BigInteger(1, s).compareTo(HALF_CURVE_ORDER) > 0) {
            throw invalid("non-canonical s value");
        }
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(hash, new Sign.SignatureData(v, r, s));
            return ("0x" + Keys.getAddress(publicKey)).toLowerCase(Locale.ROOT);
        } catch (SignatureException | IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_SIGNATURE, "Signature recovery failed", e);
        }
    }

    /** keccak256 of the signature bytes with {@code v} in 27/28 form, used as the replay key. */
    public static String signatureHash(String signatureHex) {
        byte[] sig = decode(signatureHex);
        if (sig[64] < 27) {
            sig[64] += 27;
        }
        return Numeric.toHexString(Hash.sha3(sig));
    }

    /** Encodes web3j signature data as {@code 0x}-prefixed {@code r ‖ s ‖ v}. */
    public static String toHex(Sign.SignatureData data) {
        byte[] out = new byte[SIGNATURE_LENGTH];
        System.arraycopy(data.getR(), 0, out, 0, 32);
        System.arraycopy(data.getS(), 0, out, 32, 32);
        out[64] = data.getV()[0];
        return Numeric.toHexString(out);
    }

    private static byte[] decode(String signatureHex) {
        if (signatureHex == null || signatureHex.isBlank()) {
            throw invalid("missing signature");
        }
        byte[] sig;
        try {
            sig = Numeric.hexStringToByteArray(signatureHex);
        } catch (RuntimeException e) {
            throw new ValidationException(ErrorCode.INVALID_SIGNATURE, "Signature is not hex", e);
        }
        if (sig.length != SIGNATURE_LENGTH) {
            throw invalid("expected " + SIGNATURE_LENGTH + " bytes, got " + sig.length);
        }
        return sig;
    }

    private static ValidationException invalid(String detail) {
        return new ValidationException(ErrorCode.INVALID_SIGNATURE, "Invalid signature: " + detail);
    }
}
