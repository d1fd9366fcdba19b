package com.slb.chaos_engine.common.ledger;

/**
 * Block clock advanced explicitly by the host (simulations, replays, tests).
 */
public class ManualBlockClock implements BlockClock {

    private final long genesisBlock;
    private volatile long currentBlock;

    public ManualBlockClock(long genesisBlock) {
        this.genesisBlock = genesisBlock;
        this.currentBlock = genesisBlock;
    }

    @Override
    public long currentBlock() {
        return currentBlock;
    }

    @Override
    public long genesisBlock() {
        return genesisBlock;
    }

    public void advance(long blocks) {
        if (blocks < 0) {
            throw new IllegalArgumentException("blocks must be >= 0");
        }
        currentBlock += blocks;
    }
}
