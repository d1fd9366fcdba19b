package com.slb.chaos_engine.modules.era.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "当前生效的纪元。/ Era currently in force.")
public class EraVo {

    @Schema(description = "纪元序号，从 0 开始。/ Era index, 0-based.", example = "0")
    private int index;

    @Schema(description = "纪元名称。/ Era name.", example = "Genesis")
    private String name;

    @Schema(description = "收益系数（bps），10000 = 1.0 倍。/ Reward modifier in bps, 10000 = 1.0x.", example = "15000")
    private int rewardModifierBps;

    @Schema(description = "事件可掷出的最高严重等级。/ Highest severity tier events may roll.", example = "1")
    private int maxEventTier;

    @Schema(description = "两次事件之间的最少区块数。/ Minimum blocks between two events.", example = "50000")
    private long eventCooldownBlocks;

    @Schema(description = "本纪元剩余区块数；最后一个无限期纪元为 null。/ Blocks left in this era; null for the open-ended last era.", nullable = true)
    private Long blocksRemaining;
}
