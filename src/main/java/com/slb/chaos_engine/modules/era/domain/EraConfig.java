package com.slb.chaos_engine.modules.era.domain;

/**
 * One immutable row of the era table.
 *
 * @param startOffset    first block (relative to genesis) of this era
 * @param endOffset      first block after this era, {@link Long#MAX_VALUE} for the open-ended last era
 * @param rewardModifierBps emission modifier, 10000 = 1.0x
 */
public record EraConfig(
        int index,
        String name,
        long startOffset,
        long endOffset,
        int rewardModifierBps,
        int maxEventTier,
        long eventCooldownBlocks
) {

    public boolean covers(long blocksSinceGenesis) {
        return blocksSinceGenesis >= startOffset && blocksSinceGenesis < endOffset;
    }

    public long durationBlocks() {
        return endOffset == Long.MAX_VALUE ? Long.MAX_VALUE : endOffset - startOffset;
    }
}
