package com.collectiveip.core.support;

import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.ValidationException;
import org.web3j.utils.Numeric;

import java.util.regex.Pattern;

/**
 * Validation and canonical form of party and currency addresses.
 * <p>
 * Addresses are 20-byte hex strings. The canonical form is lower-case with a {@code 0x} prefix so
 * that map lookups never depend on the checksum casing a caller happened to use.
 */
public final class Addresses {

    private static final Pattern HEX_ADDRESS = Pattern.compile("[0-9a-fA-F]{40}");

    private Addresses() {}

    /**
     * True for 40 hex digits, with or without the {@code 0x} prefix.
     */
    public static boolean isValid(String address) {
        return address != null && HEX_ADDRESS.matcher(Numeric.cleanHexPrefix(address)).matches();
    }

    /**
     * Returns the canonical form of {@code address}.
     *
     * @throws ValidationException if the address is null or not 20 hex bytes
     */
    public static String normalize(String address, String field) {
        if (!isValid(address)) {
            throw new ValidationException(ErrorReason.INVALID_ADDRESS, "Invalid " + field + " address: " + address);
        }
        return Numeric.prependHexPrefix(Numeric.cleanHexPrefix(address).toLowerCase());
    }
}
