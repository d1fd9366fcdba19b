package com.slb.chaos_engine.common.ledger;

/**
 * Entropy provided by the host for a given block (block hash, VRF output or an injected seed).
 * Implementations must return the same bytes for the same block every time.
 */
public interface EntropySource {

    byte[] seedFor(long blockNumber);
}
