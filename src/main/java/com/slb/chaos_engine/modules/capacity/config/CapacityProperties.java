package com.slb.chaos_engine.modules.capacity.config;

import jakarta.validation.Valid;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app.capacity")
@Validated
@Data
public class CapacityProperties {

    /** A unit never contributes more than this multiple of its base capacity. */
    private int unitCapMultiple = 10;

    private int quirkMinBps = 5_000;
    private int quirkMaxBps = 20_000;
    private int synergyMinBps = 7_500;
    private int synergyMaxBps = 15_000;

    @Valid
    private List<Quirk> quirks = defaultQuirks();

    private Pool pool = new Pool();
    private Dominance dominance = new Dominance();

    /** Pioneer bonus by population phase at registration (index 0 = phase 1). Missing phases get 0. */
    private List<Integer> pioneerBonusBps = new ArrayList<>(List.of(2_000, 1_000, 500, 0));

    @Data
    public static class Quirk {
        private int id;
        /** Multiplier per era index; eras past the end reuse the last value. */
        private List<Integer> eraMultiplierBps = new ArrayList<>();
        /** Zone the quirk resonates with, -1 for none. */
        private int affinityZone = -1;
        /** Extra synergy inside the affinity zone. */
        private int affinityBps;

        public Quirk() {
        }

        Quirk(int id, List<Integer> eraMultiplierBps, int affinityZone, int affinityBps) {
            this.id = id;
            this.eraMultiplierBps = new ArrayList<>(eraMultiplierBps);
            this.affinityZone = affinityZone;
            this.affinityBps = affinityBps;
        }
    }

    @Data
    public static class Pool {
        private int baseBonusBps = 1_000;
        private int homogeneousBonusBps = 500;
        private int loyaltyBonusBps = 300;
        private long loyaltyTenureBlocks = 500_000L;
        /** Pool share of network capacity where the bonus starts decaying. */
        private int decayStartShareBps = 1_500;
        /** Pool share where the bonus reaches zero and the penalty starts. */
        private int decayEndShareBps = 3_000;
        /** Pool share where the penalty reaches its maximum. */
        private int penaltyEndShareBps = 5_000;
        private int maxPenaltyBps = 2_000;
    }

    @Data
    public static class Dominance {
        private int taxStartShareBps = 100;
        private int taxEndShareBps = 500;
        private int maxTaxBps = 5_000;
    }

    private static List<Quirk> defaultQuirks() {
        List<Quirk> quirks = new ArrayList<>();
        // overclocked: strong early, burns out in later eras
        quirks.add(new Quirk(1, List.of(15_000, 12_500, 10_000, 7_500), -1, 0));
        // solar-tuned: resonates with the Solar Flats
        quirks.add(new Quirk(2, List.of(10_000), 0, 2_500));
        // void-hardened: weak early, thrives in the chaos eras and the Singer Void
        quirks.add(new Quirk(3, List.of(5_000, 7_500, 12_500, 20_000), 7, 2_000));
        // gravity-anchored
        quirks.add(new Quirk(4, List.of(11_000), 1, 1_500));
        return quirks;
    }
}
