package com.slb.chaos_engine.modules.token.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slb.chaos_engine.modules.token.enums.BurnSource;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "供应与销毁指标（金额单位 wei，18 位小数）。/ Supply and burn metrics (amounts in wei, 18 decimals).")
public class SupplyMetricsVo {

    @Schema(description = "累计铸造量，包含收益时销毁的部分。/ Total ever minted, including amounts burned on earn.")
    private BigInteger totalMinted;

    @Schema(description = "累计销毁量。/ Total ever burned.")
    private BigInteger totalBurned;

    @Schema(description = "totalMinted - totalBurned，不会超过 supplyCap。/ totalMinted - totalBurned; never above supplyCap.")
    private BigInteger circulatingSupply;

    @Schema(description = "供应硬上限。/ Hard supply ceiling.")
    private BigInteger supplyCap;

    @Schema(description = "totalBurned / totalMinted 的百分比，保留两位小数。/ totalBurned / totalMinted in percent, two decimals.", example = "19.87")
    private BigDecimal burnRatioPercent;

    @Schema(description = "按销毁来源统计的销毁量。/ Burned amount per burn source.")
    private Map<BurnSource, BigInteger> burnsBySource;
}
