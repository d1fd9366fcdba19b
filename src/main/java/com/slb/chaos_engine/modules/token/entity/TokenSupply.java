package com.slb.chaos_engine.modules.token.entity;

import com.slb.chaos_engine.modules.token.enums.BurnSource;
import lombok.Data;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ledger token account: supply totals plus per-account balances.
 * Invariant: totalMinted - totalBurned == sum(balances) <= supply cap.
 */
@Data
public class TokenSupply {

    private BigInteger totalMinted = BigInteger.ZERO;
    private BigInteger totalBurned = BigInteger.ZERO;
    private final Map<BurnSource, BigInteger> burnsBySource = new EnumMap<>(BurnSource.class);
    private final Map<String, BigInteger> balances = new LinkedHashMap<>();

    public BigInteger circulating() {
        return totalMinted.subtract(totalBurned);
    }

    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }
}
