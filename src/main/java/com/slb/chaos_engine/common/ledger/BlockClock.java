package com.slb.chaos_engine.common.ledger;

/**
 * Block height of the host ledger. The engine never reads wall-clock time.
 */
public interface BlockClock {

    long currentBlock();

    /** Block at which the engine's schedules (eras, halvings) start counting. */
    long genesisBlock();

    default long blocksSinceGenesis() {
        return Math.max(0L, currentBlock() - genesisBlock());
    }
}
