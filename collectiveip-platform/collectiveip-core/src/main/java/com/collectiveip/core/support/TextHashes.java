package com.collectiveip.core.support;

import org.web3j.crypto.Hash;

/**
 * Opaque fingerprints of free-text fields (license terms, proposal descriptions).
 */
public final class TextHashes {

    private TextHashes() {}

    /**
     * Keccak-256 of the UTF-8 bytes of {@code text}, hex encoded with a {@code 0x} prefix.
     * A null text hashes like the empty string.
     */
    public static String keccak(String text) {
        return Hash.sha3String(text == null ? "" : text);
    }
}
