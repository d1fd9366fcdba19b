package com.slb.chaos_engine.modules.era.config;

import jakarta.validation.Valid;
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
@ConfigurationProperties(prefix = "app.era")
@Validated
@Data
public class EraProperties {

    /**
     * Ordered era table. The last era is open-ended, its durationBlocks is ignored.
     */
    @NotEmpty
    @Valid
    private List<Era> eras = new ArrayList<>(List.of(
            new Era("Genesis", 2_000_000L, 15_000, 1, 50_000L),
            new Era("Expansion", 5_000_000L, 12_500, 2, 30_000L),
            new Era("Turbulence", 10_000_000L, 10_000, 3, 20_000L),
            new Era("Chaos", 0L, 8_000, 5, 10_000L)
    ));

    /**
     * Population thresholds between phases: below the first value the phase is 1, below the
     * second it is 2, and so on. Must be ascending.
     */
    @NotEmpty
    private List<Long> phaseThresholds = new ArrayList<>(List.of(50L, 200L, 1_000L));

    /** Lowest population phase in which cosmic events may be triggered. */
    @Min(1)
    private int minPhaseForEvents = 2;

    @Data
    public static class Era {
        private String name;
        @Min(0)
        private long durationBlocks;
        /** 10000 = 1.0x */
        @Min(0)
        private int rewardModifierBps = 10_000;
        @Min(1)
        @Max(5)
        private int maxEventTier = 1;
        @Min(0)
        private long eventCooldownBlocks;

        public Era() {
        }

        public Era(String name, long durationBlocks, int rewardModifierBps, int maxEventTier, long eventCooldownBlocks) {
            this.name = name;
            this.durationBlocks = durationBlocks;
            this.rewardModifierBps = rewardModifierBps;
            this.maxEventTier = maxEventTier;
            this.eventCooldownBlocks = eventCooldownBlocks;
        }
    }
}
