package com.slb.chaos_engine;

import com.slb.chaos_engine.common.api.ApiResponse;
import com.slb.chaos_engine.common.ledger.ManualBlockClock;
import com.slb.chaos_engine.modules.agent.vo.AgentProfileVo;
import com.slb.chaos_engine.modules.engine.endpoint.ChaosEngineEndpoint;
import com.slb.chaos_engine.modules.engine.service.ChaosEngineService;
import com.slb.chaos_engine.modules.engine.vo.GameStateVo;
import com.slb.chaos_engine.modules.world.domain.EquipmentUnit;
import com.slb.chaos_engine.modules.world.support.InMemoryWorld;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ChaosEngineApplicationTest {

    @Autowired
    private ChaosEngineEndpoint endpoint;
    @Autowired
    private ChaosEngineService engine;
    @Autowired
    private ManualBlockClock clock;
    @Autowired
    private InMemoryWorld world;

    @Test
    void contextWiresTheEngineEndToEnd() {
        assertThat(clock.genesisBlock()).isEqualTo(1_000L);

        ApiResponse<Long> registered = endpoint.register("wiring-test", 2, 500);
        assertThat(registered.isSuccess()).isTrue();
        long agentId = registered.getData();
        assertThat(world.getZoneAgentCount(2)).isEqualTo(1);

        world.installEquipment(agentId, List.of(new EquipmentUnit(2_000L, 0, 10_000)));
        assertThat(engine.recomputeCapacity(agentId)).isPositive();

        // first-mine delay is 100 blocks in the test profile
        ApiResponse<BigInteger> early = endpoint.claim(agentId);
        assertThat(early.isSuccess()).isFalse();
        assertThat(early.getErrorCode()).isEqualTo("MINING_FIRST_MINE_DELAY");

        clock.advance(150);
        ApiResponse<BigInteger> claimed = endpoint.claim(agentId);
        assertThat(claimed.isSuccess()).isTrue();
        assertThat(claimed.getData()).isPositive();

        assertThat(endpoint.listVestingEntries(agentId).getData()).hasSize(1);
        long entryId = endpoint.listVestingEntries(agentId).getData().get(0).getEntryId();
        assertThat(endpoint.availableToWithdraw(entryId).getData()).isZero();
        assertThat(endpoint.getAccumulatorState().getData().getTotalEffectiveHashrate())
                .isEqualTo(engine.getEffectiveHashrate(agentId));
        assertThat(endpoint.getEmissionQuote().getData().activeAgentCount()).isEqualTo(1L);
        assertThat(endpoint.getCurrentPhase().getData()).isEqualTo(1);

        AgentProfileVo profile = endpoint.getAgentProfile(agentId).getData();
        assertThat(profile.getZoneName()).isEqualTo("The Dark Forest");
        assertThat(profile.getVestingEntries()).hasSize(1);
        assertThat(profile.getLockedInVesting()).isEqualTo(claimed.getData());

        ApiResponse<Long> event = endpoint.triggerEvent("keeper");
        assertThat(event.getCode()).isEqualTo(409);
        assertThat(event.getErrorCode()).isEqualTo("EVENT_COOLDOWN");

        ApiResponse<AgentProfileVo> missing = endpoint.getAgentProfile(9_999L);
        assertThat(missing.getCode()).isEqualTo(404);
        assertThat(missing.getErrorCode()).isEqualTo("AGENT_NOT_FOUND");

        GameStateVo state = endpoint.getGameState().getData();
        assertThat(state.getEra().getName()).isEqualTo("Genesis");
        assertThat(state.getPhase()).isEqualTo(1);
        assertThat(state.isEventsUnlocked()).isFalse();
        assertThat(state.getActiveAgentCount()).isEqualTo(1L);
        assertThat(state.getNextEventBlock()).isEqualTo(1_000L + 50_000L);
        assertThat(endpoint.getSupplyMetrics().getData().getTotalMinted()).isPositive();
    }
}
