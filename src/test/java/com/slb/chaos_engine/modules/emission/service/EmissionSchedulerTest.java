package com.slb.chaos_engine.modules.emission.service;

import com.slb.chaos_engine.common.ledger.LedgerSerializer;
import com.slb.chaos_engine.common.ledger.ManualBlockClock;
import com.slb.chaos_engine.modules.agent.repository.AgentRepository;
import com.slb.chaos_engine.modules.emission.config.EmissionProperties;
import com.slb.chaos_engine.modules.emission.domain.EmissionQuote;
import com.slb.chaos_engine.modules.era.config.EraProperties;
import com.slb.chaos_engine.modules.era.domain.EraConfig;
import com.slb.chaos_engine.modules.era.service.EraPhaseService;
import com.slb.chaos_engine.modules.token.config.TokenProperties;
import com.slb.chaos_engine.modules.token.service.TokenLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;

import static com.slb.chaos_engine.common.util.FixedPointMath.WAD;
import static com.slb.chaos_engine.common.util.FixedPointMath.toWei;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmissionSchedulerTest {

    private static final long HALVING = 63_072_000L;

    @Mock
    private AgentRepository agentRepository;

    private final EmissionProperties properties = new EmissionProperties();
    private final ManualBlockClock clock = new ManualBlockClock(0L);
    private TokenLedgerService tokenLedger;
    private EmissionScheduler scheduler;
    private EraConfig turbulence;

    @BeforeEach
    void setUp() {
        tokenLedger = new TokenLedgerService(new TokenProperties(), new LedgerSerializer());
        EraPhaseService eraPhaseService = new EraPhaseService(new EraProperties(), clock);
        scheduler = new EmissionScheduler(properties, agentRepository, eraPhaseService, tokenLedger, clock);
        turbulence = eraPhaseService.getEras().get(2);
    }

    @Test
    void genesisMultiplier_isKAtZeroAndOneAtTarget() {
        assertThat(scheduler.genesisMultiplier(0)).isEqualTo(WAD.multiply(BigInteger.valueOf(20)));
        assertThat(scheduler.genesisMultiplier(500)).isEqualTo(WAD.multiply(BigInteger.valueOf(5)));
        assertThat(scheduler.genesisMultiplier(1_000)).isEqualTo(WAD);
        assertThat(scheduler.genesisMultiplier(50_000)).isEqualTo(WAD);
    }

    @Test
    void genesisMultiplier_decreasesWithPopulationAndNeverDropsBelowOne() {
        BigInteger previous = scheduler.genesisMultiplier(0);
        for (long n = 25; n <= 1_000; n += 25) {
            BigInteger current = scheduler.genesisMultiplier(n);
            assertThat(current).isLessThanOrEqualTo(previous);
            assertThat(current).isGreaterThanOrEqualTo(WAD);
            previous = current;
        }
        assertThat(scheduler.genesisMultiplier(100)).isGreaterThan(scheduler.genesisMultiplier(200));
    }

    @Test
    void quote_scalesTargetByStrongerOfGenesisAndEraModifier() {
        EmissionQuote quote = scheduler.quote(10, turbulence, 0L, BigInteger.ZERO);

        assertThat(quote.targetEmission()).isEqualTo(new BigInteger("57870370370370370"));
        assertThat(quote.genesisMultiplier()).isEqualTo(new BigInteger("19602000000000000000"));
        assertThat(quote.effectiveModifier()).isEqualTo(quote.genesisMultiplier());
        assertThat(quote.emissionPerBlock()).isEqualTo(new BigInteger("1134374999999999992"));
    }

    @Test
    void quote_noAgents_emitsNothing() {
        assertThat(scheduler.quote(0, turbulence, 0L, BigInteger.ZERO).emissionPerBlock()).isZero();
    }

    @Test
    void quote_epochCeilingHalvesEveryInterval() {
        properties.setInitialMaxPerBlockTokens(1L);

        assertThat(scheduler.quote(10, turbulence, 0L, BigInteger.ZERO).emissionPerBlock()).isEqualTo(toWei(1));
        assertThat(scheduler.quote(10, turbulence, HALVING, BigInteger.ZERO).emissionPerBlock())
                .isEqualTo(toWei(1).shiftRight(1));
        EmissionQuote third = scheduler.quote(10, turbulence, 2 * HALVING + 5, BigInteger.ZERO);
        assertThat(third.epoch()).isEqualTo(2L);
        assertThat(third.emissionPerBlock()).isEqualTo(toWei(1).shiftRight(2));
    }

    @Test
    void quote_isCappedByRemainingSupply() {
        BigInteger almostFull = tokenLedger.getSupplyCap().subtract(BigInteger.valueOf(100));

        assertThat(scheduler.quote(10, turbulence, 0L, almostFull).emissionPerBlock()).isEqualTo(BigInteger.valueOf(100));
        assertThat(scheduler.quote(10, turbulence, 0L, tokenLedger.getSupplyCap()).emissionPerBlock()).isZero();
    }

    @Test
    void emissionPerBlock_readsLivePopulation() {
        when(agentRepository.countActive()).thenReturn(10L);

        // genesis era: the population multiplier (19.6x) beats the era's 1.5x
        assertThat(scheduler.emissionPerBlock()).isEqualTo(new BigInteger("1134374999999999992"));
    }
}
