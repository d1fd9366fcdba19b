package com.slb.chaos_engine.modules.engine.endpoint;

import com.slb.chaos_engine.common.api.ApiResponse;
import com.slb.chaos_engine.common.api.GlobalErrorTranslator;
import com.slb.chaos_engine.modules.agent.vo.AgentProfileVo;
import com.slb.chaos_engine.modules.emission.domain.EmissionQuote;
import com.slb.chaos_engine.modules.engine.service.ChaosEngineService;
import com.slb.chaos_engine.modules.engine.vo.GameStateVo;
import com.slb.chaos_engine.modules.era.vo.EraVo;
import com.slb.chaos_engine.modules.event.vo.EventVo;
import com.slb.chaos_engine.modules.mining.service.MiningService;
import com.slb.chaos_engine.modules.mining.vo.AccumulatorStateVo;
import com.slb.chaos_engine.modules.mining.vo.PendingRewardsVo;
import com.slb.chaos_engine.modules.token.vo.SupplyMetricsVo;
import com.slb.chaos_engine.modules.vesting.vo.VestingEntryVo;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * 引擎响应封装入口 / Envelope-returning variants of the engine entry points for transports (RPC bridges, bots).
 * Failures come back as {@link ApiResponse} errors carrying the machine code instead of exceptions.
 */
@Component
public class ChaosEngineEndpoint {

    private final ChaosEngineService engine;
    private final MiningService miningService;
    private final GlobalErrorTranslator errorTranslator;

    public ChaosEngineEndpoint(ChaosEngineService engine, MiningService miningService, GlobalErrorTranslator errorTranslator) {
        this.engine = engine;
        this.miningService = miningService;
        this.errorTranslator = errorTranslator;
    }

    /**
     * One agent per operator. Returns the new agent id.
     */
    public ApiResponse<Long> register(String operator, int zone, int resilienceBps) {
        return errorTranslator.execute(() -> engine.register(operator, zone, resilienceBps));
    }

    public ApiResponse<Long> heartbeat(long agentId) {
        return errorTranslator.execute(() -> engine.heartbeat(agentId));
    }

    public ApiResponse<Boolean> deactivateIfSilent(long agentId) {
        return errorTranslator.execute(() -> engine.deactivateIfSilent(agentId));
    }

    public ApiResponse<Boolean> touch() {
        return errorTranslator.execute(engine::touch);
    }

    /**
     * Moves accrued rewards into a new vesting entry. Returns the amount in wei.
     */
    public ApiResponse<BigInteger> claim(long agentId) {
        return errorTranslator.execute(() -> engine.claim(agentId));
    }

    public ApiResponse<PendingRewardsVo> getPendingRewards(long agentId) {
        return errorTranslator.execute(() -> miningService.getPendingRewardsView(agentId));
    }

    public ApiResponse<AccumulatorStateVo> getAccumulatorState() {
        return errorTranslator.execute(engine::getAccumulatorState);
    }

    public ApiResponse<EmissionQuote> getEmissionQuote() {
        return errorTranslator.execute(engine::getEmissionQuote);
    }

    public ApiResponse<List<VestingEntryVo>> listVestingEntries(long agentId) {
        return errorTranslator.execute(() -> engine.listVestingEntries(agentId));
    }

    public ApiResponse<BigInteger> availableToWithdraw(long entryId) {
        return errorTranslator.execute(() -> engine.availableToWithdraw(entryId));
    }

    public ApiResponse<BigInteger> withdrawVested(long entryId) {
        return errorTranslator.execute(() -> engine.withdrawVested(entryId));
    }

    /**
     * Releases the remainder now; the penalty share is burned.
     */
    public ApiResponse<BigInteger> claimEarly(long entryId) {
        return errorTranslator.execute(() -> engine.claimEarly(entryId));
    }

    public ApiResponse<Long> triggerEvent(String caller) {
        return errorTranslator.execute(() -> engine.triggerEvent(caller));
    }

    /**
     * Returns the number of agents damaged.
     */
    public ApiResponse<Integer> processShard(long eventId, int zoneId, int shardIndex, String caller) {
        return errorTranslator.execute(() -> engine.processShard(eventId, zoneId, shardIndex, caller));
    }

    public ApiResponse<EventVo> getEvent(long eventId) {
        return errorTranslator.execute(() -> engine.getEvent(eventId));
    }

    /**
     * Newest first, count clamped to 1..50.
     */
    public ApiResponse<List<EventVo>> getRecentEvents(int count) {
        return errorTranslator.execute(() -> engine.getRecentEvents(count));
    }

    public ApiResponse<AgentProfileVo> getAgentProfile(long agentId) {
        return errorTranslator.execute(() -> engine.getAgentProfile(agentId));
    }

    public ApiResponse<EraVo> getCurrentEra() {
        return errorTranslator.execute(engine::getCurrentEra);
    }

    public ApiResponse<Integer> getCurrentPhase() {
        return errorTranslator.execute(engine::getCurrentPhase);
    }

    public ApiResponse<GameStateVo> getGameState() {
        return errorTranslator.execute(engine::getGameState);
    }

    public ApiResponse<SupplyMetricsVo> getSupplyMetrics() {
        return errorTranslator.execute(engine::getSupplyMetrics);
    }
}
