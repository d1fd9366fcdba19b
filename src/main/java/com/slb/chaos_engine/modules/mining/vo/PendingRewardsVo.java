package com.slb.chaos_engine.modules.mining.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "单个代理的收益状态（金额单位 wei）。/ Reward status of one agent (amounts in wei).")
public class PendingRewardsVo {

    @Schema(description = "代理 ID。/ Agent id.", example = "7")
    private Long agentId;

    @Schema(description = "当前可领取金额，推算至当前区块。/ Claimable now, projected to the current block.")
    private BigInteger pendingRewards;

    @Schema(description = "累计领取进入归属的金额。/ Total ever claimed into vesting.")
    private BigInteger totalClaimed;

    @Schema(description = "已领取但尚未释放的金额。/ Claimed but not yet released.")
    private BigInteger lockedInVesting;

    @Schema(description = "缓存的有效算力。/ Cached effective hashrate.")
    private long effectiveHashrate;

    @Schema(description = "开始接受领取的首个区块。/ First block at which claims are accepted.")
    private long claimableFromBlock;
}
