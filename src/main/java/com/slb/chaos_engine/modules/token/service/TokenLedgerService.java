package com.slb.chaos_engine.modules.token.service;

import com.slb.chaos_engine.common.exception.BizException;
import com.slb.chaos_engine.common.exception.EngineErrorType;
import com.slb.chaos_engine.common.exception.PreconditionException;
import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.common.util.FixedPointMath;
import com.slb.chaos_engine.modules.token.config.TokenProperties;
import com.slb.chaos_engine.modules.token.domain.MintReceipt;
import com.slb.chaos_engine.modules.token.entity.TokenSupply;
import com.slb.chaos_engine.modules.token.enums.BurnSource;
import com.slb.chaos_engine.modules.token.vo.SupplyMetricsVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;

/**
 * 代币账本服务 / Ledger token account. Every mint is floored at the remaining supply instead of failing, so
 * callers that mint incidentally (accumulator touches, bounties) can never brick the engine.
 */
@Service
@Slf4j
public class TokenLedgerService {

    private final TokenProperties properties;
    private final LedgerSerializer serializer;
    private final TokenSupply supply = new TokenSupply();
    private final BigInteger supplyCap;

    public TokenLedgerService(TokenProperties properties, LedgerSerializer serializer) {
        this.properties = properties;
        this.serializer = serializer;
        this.supplyCap = FixedPointMath.toWei(properties.getSupplyCapTokens());
    }

    public BigInteger getSupplyCap() {
        return supplyCap;
    }

    public String getReserveAccount() {
        return properties.getReserveAccount();
    }

    public BigInteger totalMinted() {
        return supply.getTotalMinted();
    }

    public BigInteger totalBurned() {
        return supply.getTotalBurned();
    }

    public BigInteger circulatingSupply() {
        return supply.circulating();
    }

    public BigInteger remainingSupply() {
        return FixedPointMath.floorAtZero(supplyCap.subtract(supply.circulating()));
    }

    public BigInteger balanceOf(String account) {
        return supply.balanceOf(account);
    }

    public BigInteger burnedBy(BurnSource source) {
        return supply.getBurnsBySource().getOrDefault(source, BigInteger.ZERO);
    }

    /**
     * Mints {@code amount} to {@code account}, floored at the remaining supply.
     */
    public MintReceipt mint(String account, BigInteger amount) {
        return mintNetOfBurn(account, amount, BigInteger.ZERO, BurnSource.MINING);
    }

    /**
     * Mints {@code net + burn}, immediately burning {@code burn}. Only {@code net} enters circulation,
     * so only {@code net} is checked against the cap; when it is floored the burn shrinks in proportion.
     */
    public MintReceipt mintNetOfBurn(String account, BigInteger net, BigInteger burn, BurnSource burnSource) {
        requireAccount(account);
        if (net.signum() < 0 || burn.signum() < 0) {
            throw new BizException(EngineErrorType.INVALID_ARGUMENT, "mint amounts must be non-negative");
        }
        return serializer.call(() -> {
            BigInteger remaining = remainingSupply();
            BigInteger mintedNet = net;
            BigInteger burned = burn;
            boolean clamped = false;
            if (net.compareTo(remaining) > 0) {
                mintedNet = remaining;
                burned = net.signum() == 0 ? BigInteger.ZERO : FixedPointMath.mulDiv(burn, remaining, net);
                clamped = true;
                log.warn("Mint clamped at supply cap: account={}, requested={}, minted={}", account, net, mintedNet);
            }
            if (mintedNet.signum() == 0 && burned.signum() == 0) {
                return new MintReceipt(BigInteger.ZERO, BigInteger.ZERO, clamped);
            }
            supply.setTotalMinted(supply.getTotalMinted().add(mintedNet).add(burned));
            credit(account, mintedNet);
            if (burned.signum() > 0) {
                supply.setTotalBurned(supply.getTotalBurned().add(burned));
                supply.getBurnsBySource().merge(burnSource, burned, BigInteger::add);
            }
            return new MintReceipt(mintedNet, burned, clamped);
        });
    }

    /**
     * Burns from an account's balance, e.g. marketplace purchases or the early-claim penalty.
     */
    public void burnFrom(String account, BigInteger amount, BurnSource source) {
        requireAccount(account);
        if (amount.signum() <= 0) {
            return;
        }
        serializer.run(() -> {
            debit(account, amount);
            supply.setTotalBurned(supply.getTotalBurned().add(amount));
            supply.getBurnsBySource().merge(source, amount, BigInteger::add);
            log.info("Burned tokens: account={}, amount={}, source={}", account, amount, source);
        });
    }

    public void transfer(String from, String to, BigInteger amount) {
        requireAccount(from);
        requireAccount(to);
        if (amount.signum() <= 0) {
            return;
        }
        serializer.run(() -> {
            debit(from, amount);
            credit(to, amount);
        });
    }

    public SupplyMetricsVo getSupplyMetrics() {
        return serializer.call(() -> {
            SupplyMetricsVo vo = new SupplyMetricsVo();
            vo.setTotalMinted(supply.getTotalMinted());
            vo.setTotalBurned(supply.getTotalBurned());
            vo.setCirculatingSupply(supply.circulating());
            vo.setSupplyCap(supplyCap);
            vo.setBurnRatioPercent(burnRatioPercent());
            Map<BurnSource, BigInteger> bySource = new EnumMap<>(BurnSource.class);
            for (BurnSource source : BurnSource.values()) {
                bySource.put(source, burnedBy(source));
            }
            vo.setBurnsBySource(bySource);
            return vo;
        });
    }

    private BigDecimal burnRatioPercent() {
        if (supply.getTotalMinted().signum() == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.DOWN);
        }
        BigInteger basisPoints = supply.getTotalBurned().multiply(FixedPointMath.BPS).divide(supply.getTotalMinted());
        return new BigDecimal(basisPoints).divide(BigDecimal.valueOf(100), 2, RoundingMode.DOWN);
    }

    private void credit(String account, BigInteger amount) {
        if (amount.signum() > 0) {
            supply.getBalances().merge(account, amount, BigInteger::add);
        }
    }

    private void debit(String account, BigInteger amount) {
        BigInteger balance = supply.balanceOf(account);
        if (balance.compareTo(amount) < 0) {
            throw new PreconditionException(EngineErrorType.INSUFFICIENT_BALANCE,
                    "account " + account + " holds " + balance + ", needs " + amount);
        }
        supply.getBalances().put(account, balance.subtract(amount));
    }

    private void requireAccount(String account) {
        if (!StringUtils.hasText(account)) {
            throw new BizException(EngineErrorType.INVALID_ARGUMENT, "account must not be blank");
        }
    }
}
