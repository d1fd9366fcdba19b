package com.slb.chaos_engine.modules.engine.vo;

import com.slb.chaos_engine.modules.era.vo.EraVo;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;
import java.util.Map;

@Data
@Schema(description = "引擎世界级快照。/ World-level snapshot of the engine.")
public class GameStateVo {

    @Schema(description = "当前账本区块。/ Current ledger block.")
    private long blockNumber;

    private EraVo era;

    private long activeAgentCount;

    @Schema(description = "人口阶段，从 1 开始。/ Population phase, 1-based.", example = "2")
    private int phase;

    @Schema(description = "当前人口阶段是否允许触发事件。/ Whether the population phase allows event triggers.")
    private boolean eventsUnlocked;

    @Schema(description = "各区域的代理数量。/ Agents per zone id.")
    private Map<Integer, Integer> zoneAgentCounts;

    @Schema(description = "最近一次事件的触发区块，首个事件前为创世区块。/ Trigger block of the latest event, genesis before the first.")
    private long lastEventBlock;

    @Schema(description = "冷却结束、可再次触发事件的首个区块。/ First block at which the cooldown allows another event.")
    private long nextEventBlock;

    @Schema(description = "当前每区块排放量（wei）。/ Current per-block emission in wei.")
    private BigInteger emissionPerBlock;

    private long totalEffectiveHashrate;
}
