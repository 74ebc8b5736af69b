package com.qqsuccubus.pipeline.core.hash;

import com.google.common.hash.Hashing;

/**
 * Checksums used by the chunking contract.
 * <p>
 * CRC32C, rendered as 8 lowercase hex characters. Not a cryptographic digest.
 * </p>
 */
public final class Checksums {
    private Checksums() {
    }

    /**
     * Computes CRC32C over the given bytes.
     *
     * @param data Input bytes
     * @return 8-character lowercase hex string
     */
    public static String crc32c(byte[] data) {
        return String.format("%08x", Hashing.crc32c().hashBytes(data).padToLong());
    }

    /**
     * Compares a checksum against the data, ignoring hex case.
     */
    public static boolean matches(String expected, byte[] data) {
        return expected != null && expected.equalsIgnoreCase(crc32c(data));
    }
}
