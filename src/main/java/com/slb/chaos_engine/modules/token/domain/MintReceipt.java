package com.slb.chaos_engine.modules.token.domain;

import java.math.BigInteger;

/**
 * What a cap-enforced mint actually did.
 *
 * @param net     amount that entered circulation
 * @param burned  amount minted and burned in the same step
 * @param clamped true when the request was floored at the remaining supply
 */
public record MintReceipt(BigInteger net, BigInteger burned, boolean clamped) {
}
