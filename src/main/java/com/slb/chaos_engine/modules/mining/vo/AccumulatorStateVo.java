package com.slb.chaos_engine.modules.mining.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "全局累加器快照。/ Global accumulator snapshot.")
public class AccumulatorStateVo {

    @Schema(description = "自创世以来的单位算力收益，按 1e18 缩放。/ Reward per hash since genesis, 1e18 scaled.")
    private BigInteger accRewardPerHash;

    @Schema(description = "活跃代理有效算力之和。/ Sum of effective hashrate of active agents.")
    private long totalEffectiveHashrate;

    @Schema(description = "累加器最近一次更新的区块。/ Block of the last accumulator update.")
    private long lastUpdateBlock;

    @Schema(description = "累计铸造量（wei）。/ Total minted, wei.")
    private BigInteger totalMinted;

    @Schema(description = "累计销毁量（wei）。/ Total burned, wei.")
    private BigInteger totalBurned;

    @Schema(description = "为矿工铸造的净排放量（wei）。/ Net emission minted for miners, wei.")
    private BigInteger totalNetEmission;
}
