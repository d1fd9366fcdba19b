package com.slb.chaos_engine.modules.era.service;

import com.slb.chaos_engine.common.ledger.BlockClock;
import com.slb.chaos_engine.modules.era.config.EraProperties;
import com.slb.chaos_engine.modules.era.domain.EraConfig;
import com.slb.chaos_engine.modules.era.vo.EraVo;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 纪元与人口阶段服务 / Era and population phase lookups.
 * <p>
 * Both are pure queries recomputed by every consumer on demand; there are no transition hooks and
 * no scheduled job, so a transition can never be missed.
 */
@Service
public class EraPhaseService {

    private final BlockClock blockClock;
    private final List<EraConfig> eras;
    private final long[] phaseThresholds;
    private final int minPhaseForEvents;

    public EraPhaseService(EraProperties properties, BlockClock blockClock) {
        this.blockClock = blockClock;
        this.eras = buildTable(properties.getEras());
        this.phaseThresholds = properties.getPhaseThresholds().stream().mapToLong(Long::longValue).toArray();
        for (int i = 1; i < phaseThresholds.length; i++) {
            if (phaseThresholds[i] <= phaseThresholds[i - 1]) {
                throw new IllegalStateException("app.era.phase-thresholds must be strictly ascending");
            }
        }
        this.minPhaseForEvents = properties.getMinPhaseForEvents();
    }

    public List<EraConfig> getEras() {
        return eras;
    }

    public EraConfig currentEra() {
        return eraAt(blockClock.currentBlock());
    }

    /**
     * Era in force at an absolute block number. Blocks before genesis belong to the first era.
     */
    public EraConfig eraAt(long blockNumber) {
        long offset = Math.max(0L, blockNumber - blockClock.genesisBlock());
        for (EraConfig era : eras) {
            if (era.covers(offset)) {
                return era;
            }
        }
        return eras.get(eras.size() - 1);
    }

    /**
     * Thresholded step function over the active population, phases numbered from 1.
     */
    public int phaseFor(long activeAgentCount) {
        int phase = 1;
        for (long threshold : phaseThresholds) {
            if (activeAgentCount < threshold) {
                return phase;
            }
            phase++;
        }
        return phase;
    }

    public int getMinPhaseForEvents() {
        return minPhaseForEvents;
    }

    public EraVo toVo(EraConfig era) {
        EraVo vo = new EraVo();
        vo.setIndex(era.index());
        vo.setName(era.name());
        vo.setRewardModifierBps(era.rewardModifierBps());
        vo.setMaxEventTier(era.maxEventTier());
        vo.setEventCooldownBlocks(era.eventCooldownBlocks());
        if (era.endOffset() != Long.MAX_VALUE) {
            vo.setBlocksRemaining(Math.max(0L, era.endOffset() - blockClock.blocksSinceGenesis()));
        }
        return vo;
    }

    private static List<EraConfig> buildTable(List<EraProperties.Era> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalStateException("app.era.eras must define at least one era");
        }
        List<EraConfig> table = new ArrayList<>(definitions.size());
        long start = 0L;
        for (int i = 0; i < definitions.size(); i++) {
            EraProperties.Era def = definitions.get(i);
            boolean last = i == definitions.size() - 1;
            if (!last && def.getDurationBlocks() <= 0) {
                throw new IllegalStateException("era " + i + " needs a positive durationBlocks");
            }
            long end = last ? Long.MAX_VALUE : start + def.getDurationBlocks();
            table.add(new EraConfig(i, def.getName(), start, end, def.getRewardModifierBps(),
                    def.getMaxEventTier(), def.getEventCooldownBlocks()));
            start = end;
        }
        return Collections.unmodifiableList(table);
    }
}
