package com.slb.chaos_engine.modules.agent.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slb.chaos_engine.modules.vesting.vo.VestingEntryVo;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "代理档案，含收益、归属与防御状态（金额单位 wei）。/ Agent profile with reward, vesting and defense state (amounts in wei).")
public class AgentProfileVo {

    @Schema(description = "代理 ID。/ Agent id.", example = "7")
    private Long agentId;

    @Schema(description = "接收已释放收益的运营者账户。/ Operator account receiving released rewards.")
    private String operator;

    private int zone;

    @Schema(description = "区域显示名称。/ Zone display name.", example = "The Dark Forest")
    private String zoneName;

    @Schema(description = "宇宙抗性（bps）。/ Cosmic resilience in bps.")
    private int resilienceBps;

    @Schema(description = "注册时的人口阶段。/ Population phase at registration.", example = "1")
    private int pioneerPhase;

    private long registrationBlock;

    private long lastTouchBlock;

    private boolean active;

    private long effectiveHashrate;

    private BigInteger pendingRewards;

    private BigInteger totalClaimed;

    private BigInteger lockedInVesting;

    @Schema(description = "运营者代币余额。/ Operator token balance.")
    private BigInteger operatorBalance;

    @Schema(description = "避难所减伤（bps）。/ Shelter reduction in bps.")
    private int shelterBps;

    @Schema(description = "护盾吸收（bps）。/ Shield absorption in bps.")
    private int shieldAbsorptionBps;

    private List<VestingEntryVo> vestingEntries;
}
