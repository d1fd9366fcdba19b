package com.slb.chaos_engine.modules.emission.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "app.emission")
@Validated
@Data
public class EmissionProperties {

    /** Tokens each active agent should earn per day at modifier 1.0x. */
    @Min(0)
    private long targetDailyPerAgentTokens = 1_000L;

    @Positive
    private long blocksPerDay = 172_800L;

    /** K: multiplier granted at zero population, decaying quadratically to 1.0x at N0. */
    @Min(1)
    private long genesisMaxMultiplier = 20L;

    /** N0: population at which the genesis multiplier reaches 1.0x. */
    @Positive
    private long genesisPopulationTarget = 1_000L;

    /** Per-block ceiling in epoch 0, halved every epoch. */
    @Min(0)
    private long initialMaxPerBlockTokens = 5_000L;

    @Positive
    private long halvingIntervalBlocks = 63_072_000L;
}
