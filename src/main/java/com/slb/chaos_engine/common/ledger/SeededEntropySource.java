package com.slb.chaos_engine.common.ledger;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives a per-block seed as SHA-256(secret || blockNumber). Used where no ledger block hash exists.
 */
public class SeededEntropySource implements EntropySource {

    private final byte[] secret;

    public SeededEntropySource(String secret) {
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] seedFor(long blockNumber) {
        MessageDigest digest = sha256();
        digest.update(secret);
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(blockNumber).array());
        return digest.digest();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
