package com.slb.chaos_engine.modules.event.service;

import com.slb.chaos_engine.common.ledger.EntropySource;
import com.slb.chaos_engine.modules.event.domain.EventRoll;
import com.slb.chaos_engine.modules.event.enums.CosmicEventType;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Seeded event PRNG. Word {@code n} is the first 8 bytes of
 * SHA-256(seed(triggerBlock) || eventId || n), so the same block and id always roll the same event.
 */
@Component
public class EventRandomness {

    private static final int WORD_TYPE = 0;
    private static final int WORD_TIER = 1;
    private static final int WORD_ORIGIN = 2;

    private final EntropySource entropySource;

    public EventRandomness(EntropySource entropySource) {
        this.entropySource = entropySource;
    }

    /**
     * @param maxTier   highest tier the current era allows, at least 1
     * @param zoneCount zones on the ring, 1..8
     */
    public EventRoll roll(long triggerBlock, long eventId, int maxTier, int zoneCount) {
        if (maxTier < 1 || zoneCount < 1) {
            throw new IllegalArgumentException("maxTier and zoneCount must be >= 1");
        }
        byte[] seed = entropySource.seedFor(triggerBlock);
        CosmicEventType type = CosmicEventType.fromIndex(bounded(seed, eventId, WORD_TYPE, CosmicEventType.values().length));
        int tier = 1 + bounded(seed, eventId, WORD_TIER, maxTier);
        int origin = bounded(seed, eventId, WORD_ORIGIN, zoneCount);
        return new EventRoll(type, tier, origin, affectedMask(origin, tier, zoneCount));
    }

    /**
     * Origin plus {@code (tier - 1) / 2} neighbours on each side, wrapping around the ring.
     */
    static int affectedMask(int origin, int tier, int zoneCount) {
        int radius = Math.min((tier - 1) / 2, zoneCount / 2);
        int mask = 0;
        for (int offset = -radius; offset <= radius; offset++) {
            mask |= 1 << Math.floorMod(origin + offset, zoneCount);
        }
        return mask;
    }

    private static int bounded(byte[] seed, long eventId, int counter, int bound) {
        MessageDigest digest = sha256();
        digest.update(seed);
        digest.update(ByteBuffer.allocate(Long.BYTES + Integer.BYTES).putLong(eventId).putInt(counter).array());
        long word = ByteBuffer.wrap(digest.digest()).getLong();
        return (int) Math.floorMod(word, (long) bound);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
