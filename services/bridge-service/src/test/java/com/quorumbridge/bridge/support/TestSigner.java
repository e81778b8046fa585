package com.quorumbridge.bridge.support;

import com.quorumbridge.bridge.crypto.CanonicalMessage;
import com.quorumbridge.bridge.crypto.SignatureVerifier;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Deterministic secp256k1 key used to produce validator signatures in tests.
 */
public final class TestSigner {

    private final ECKeyPair keyPair;

    private TestSigner(ECKeyPair keyPair) {
        this.keyPair = keyPair;
    }

    public static TestSigner fromSeed(long seed) {
        return new TestSigner(ECKeyPair.create(BigInteger.valueOf(seed).add(BigInteger.valueOf(0x1000))));
    }

    public String address() {
        return ("0x" + Keys.getAddress(keyPair.getPublicKey())).toLowerCase(Locale.ROOT);
    }

    public String sign(byte[] hash) {
        return SignatureVerifier.toHex(Sign.signPrefixedMessage(hash, keyPair));
    }

    public String sign(String hashHex) {
        return sign(CanonicalMessage.fromHex(hashHex));
    }
}
