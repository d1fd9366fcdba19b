package com.slb.chaos_engine.modules.event.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app.event")
@Validated
@Data
public class EventProperties {

    /** Agents damaged per processShard call. */
    @Min(1)
    private int shardSize = 128;

    /** Base damage per severity tier (index 0 = tier 1), in bps of durability. */
    @NotEmpty
    private List<Integer> tierBaseDamageBps = new ArrayList<>(List.of(500, 1_000, 2_000, 3_500, 5_000));

    /** Paid to whoever triggers an event. */
    @Min(0)
    private long triggerBountyTokens = 10L;

    /** Paid to the shard processor per agent processed. */
    @Min(0)
    private long perAgentBountyTokens = 1L;

    /** Hard cap on shelter + shield reduction. */
    @Min(0)
    @Max(10_000)
    private int maxDefenseReductionBps = 9_000;

    /** Upper bound for recent-event listings. */
    @Min(1)
    private int recentEventsLimit = 50;
}
