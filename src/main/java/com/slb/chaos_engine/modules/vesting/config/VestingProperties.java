package com.slb.chaos_engine.modules.vesting.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "app.vesting")
@Validated
@Data
public class VestingProperties {

    /** Linear release period of every claimed amount. */
    @Positive
    private long durationBlocks = 200_000L;

    /** Share of the unreleased remainder burned when an entry is claimed early. */
    @Min(0)
    @Max(10_000)
    private int earlyClaimPenaltyBps = 5_000;
}
