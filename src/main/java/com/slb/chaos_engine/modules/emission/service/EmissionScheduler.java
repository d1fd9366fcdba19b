package com.slb.chaos_engine.modules.emission.service;

import com.slb.chaos_engine.common.ledger.BlockClock;
import com.slb.chaos_engine.common.util.FixedPointMath;
import com.slb.chaos_engine.modules.agent.repository.AgentRepository;
import com.slb.chaos_engine.modules.emission.config.EmissionProperties;
import com.slb.chaos_engine.modules.emission.domain.EmissionQuote;
import com.slb.chaos_engine.modules.era.domain.EraConfig;
import com.slb.chaos_engine.modules.era.service.EraPhaseService;
import com.slb.chaos_engine.modules.token.service.TokenLedgerService;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

import static com.slb.chaos_engine.common.util.FixedPointMath.WAD;

/**
 * 自适应排放调度 / Adaptive per-block emission.
 * <p>
 * The result is capped by the epoch ceiling and the remaining supply at quote time, but that alone
 * does not bound a multi-block mint: the accumulator re-checks the cap when it mints.
 */
@Service
public class EmissionScheduler {

    private final EmissionProperties properties;
    private final AgentRepository agentRepository;
    private final EraPhaseService eraPhaseService;
    private final TokenLedgerService tokenLedger;
    private final BlockClock blockClock;

    public EmissionScheduler(EmissionProperties properties,
                             AgentRepository agentRepository,
                             EraPhaseService eraPhaseService,
                             TokenLedgerService tokenLedger,
                             BlockClock blockClock) {
        this.properties = properties;
        this.agentRepository = agentRepository;
        this.eraPhaseService = eraPhaseService;
        this.tokenLedger = tokenLedger;
        this.blockClock = blockClock;
    }

    public BigInteger emissionPerBlock() {
        return currentQuote().emissionPerBlock();
    }

    public EmissionQuote currentQuote() {
        return quote(agentRepository.countActive(),
                eraPhaseService.currentEra(),
                blockClock.blocksSinceGenesis(),
                tokenLedger.circulatingSupply());
    }

    /**
     * Pure emission function of population, era, schedule position and supply.
     */
    public EmissionQuote quote(long activeAgentCount, EraConfig era, long blocksSinceGenesis, BigInteger currentSupply) {
        long agents = Math.max(0L, activeAgentCount);
        BigInteger target = FixedPointMath.toWei(properties.getTargetDailyPerAgentTokens())
                .multiply(BigInteger.valueOf(agents))
                .divide(BigInteger.valueOf(properties.getBlocksPerDay()));

        BigInteger genesis = genesisMultiplier(agents);
        BigInteger eraModifier = FixedPointMath.mulDiv(WAD, BigInteger.valueOf(era.rewardModifierBps()), FixedPointMath.BPS);
        BigInteger effective = FixedPointMath.max(genesis, eraModifier);
        BigInteger emission = FixedPointMath.mulDiv(target, effective, WAD);

        long epoch = Math.max(0L, blocksSinceGenesis) / properties.getHalvingIntervalBlocks();
        BigInteger maxForEpoch = epoch >= Integer.MAX_VALUE
                ? BigInteger.ZERO
                : FixedPointMath.toWei(properties.getInitialMaxPerBlockTokens()).shiftRight((int) epoch);
        BigInteger remaining = FixedPointMath.floorAtZero(tokenLedger.getSupplyCap().subtract(currentSupply));

        BigInteger result = FixedPointMath.floorAtZero(
                FixedPointMath.min(emission, FixedPointMath.min(maxForEpoch, remaining)));
        return new EmissionQuote(agents, era.index(), epoch, target, genesis, effective, maxForEpoch, remaining, result);
    }

    /**
     * {@code max(1.0, K * (1 - n/N0)^2)} in 1e18 precision.
     */
    public BigInteger genesisMultiplier(long activeAgentCount) {
        long n0 = properties.getGenesisPopulationTarget();
        if (activeAgentCount >= n0) {
            return WAD;
        }
        BigInteger gap = BigInteger.valueOf(n0 - Math.max(0L, activeAgentCount));
        BigInteger scaled = WAD.multiply(BigInteger.valueOf(properties.getGenesisMaxMultiplier()))
                .multiply(gap.multiply(gap))
                .divide(BigInteger.valueOf(n0).multiply(BigInteger.valueOf(n0)));
        return FixedPointMath.max(WAD, scaled);
    }
}
