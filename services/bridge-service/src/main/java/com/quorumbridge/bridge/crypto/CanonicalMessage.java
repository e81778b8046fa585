package com.quorumbridge.bridge.crypto;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;

/**
 * Hashes that validators sign and that the bridge records.
 *
 * <p>The transfer message is {@code keccak256(nonce ‖ user ‖ amount ‖ sourceChainId ‖
 * destinationChainId)} with tightly packed encoding: uint256 values as 32 big-endian
 * bytes, the address as its 20 raw bytes.</p>
 */
public final class CanonicalMessage {

    private static final int WORD = 32;

    private CanonicalMessage() {
    }

    public static byte[] transferHash(long nonce, String user, BigInteger amount,
                                      long sourceChainId, long destinationChainId) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(WORD * 4 + 20);
        out.writeBytes(word(BigInteger.valueOf(nonce)));
        out.writeBytes(Numeric.hexStringToByteArray(Addresses.normalize(user)));
        out.writeBytes(word(amount));
        out.writeBytes(word(BigInteger.valueOf(sourceChainId)));
        out.writeBytes(word(BigInteger.valueOf(destinationChainId)));
        return Hash.sha3(out.toByteArray());
    }

    /** {@code keccak256(messageHash ‖ salt)}; the salt must be 32 bytes. */
    public static byte[] commitment(byte[] messageHash, byte[] salt) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(WORD * 2);
        out.writeBytes(messageHash);
        out.writeBytes(salt);
        return Hash.sha3(out.toByteArray());
    }

    /**
     * Proof of completion: the message hash followed by the attesting addresses in
     * ascending order, so the result does not depend on arrival order.
     */
    public static byte[] destinationProof(byte[] messageHash, Collection<String> attesters) {
        List<String> sorted = attesters.stream().map(Addresses::normalize).sorted().toList();
        ByteArrayOutputStream out = new ByteArrayOutputStream(WORD + 20 * sorted.size());
        out.writeBytes(messageHash);
        sorted.forEach(a -> out.writeBytes(Numeric.hexStringToByteArray(a)));
        return Hash.sha3(out.toByteArray());
    }

    public static String toHex(byte[] hash) {
        return Numeric.toHexString(hash);
    }

    public static byte[] fromHex(String hex) {
        return Numeric.hexStringToByteArray(hex);
    }

    private static byte[] word(BigInteger value) {
        return Numeric.toBytesPadded(value, WORD);
    }
}
