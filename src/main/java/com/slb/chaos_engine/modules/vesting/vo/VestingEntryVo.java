package com.slb.chaos_engine.modules.vesting.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "归属条目状态（金额单位 wei）。/ Vesting entry state (amounts in wei).")
public class VestingEntryVo {

    @Schema(description = "条目 ID。/ Entry id.")
    private Long entryId;

    @Schema(description = "所属代理。/ Owning agent.")
    private Long agentId;

    @Schema(description = "本次领取锁定的总额。/ Total amount locked by the claim.")
    private BigInteger amount;

    @Schema(description = "已归属金额：amount * min(1, elapsed / duration)。/ Vested so far: amount * min(1, elapsed / duration).")
    private BigInteger availableToWithdraw;

    @Schema(description = "已释放给运营者的金额。/ Already released to the operator.")
    private BigInteger claimedSoFar;

    @Schema(description = "归属开始区块。/ Block at which vesting started.")
    private long startBlock;

    @Schema(description = "归属时长（区块数）。/ Vesting duration in blocks.")
    private long durationBlocks;
}
