package com.quorumbridge.bridge.crypto;

import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Chain address helpers. Addresses are stored and compared in lower case.
 */
public final class Addresses {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address).matches()
                && !ZERO_ADDRESS.equals(address.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the lower-case form of a well-formed, non-zero address.
     *
     * @throws ValidationException with {@link ErrorCode#INVALID_ADDRESS} otherwise
     */
    public static String normalize(String address) {
        if (!isValid(address)) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, "Invalid address: " + address);
        }
        return address.toLowerCase(Locale.ROOT);
    }

    public static boolean same(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }
}
