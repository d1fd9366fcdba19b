package com.slb.chaos_engine.modules.event.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slb.chaos_engine.modules.event.enums.CosmicEventType;
import com.slb.chaos_engine.modules.event.enums.EventStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "宇宙事件记录。/ Cosmic event record.")
public class EventVo {

    @Schema(description = "事件 ID。/ Event id.", example = "3")
    private Long eventId;

    @Schema(description = "事件类型。/ Event type.", example = "SOLAR_FLARE")
    private CosmicEventType eventType;

    @Schema(description = "严重等级，1..5。/ Severity tier, 1..5.", example = "2")
    private int severityTier;

    @Schema(description = "区域与防御缩放前的基础耐久伤害（bps）。/ Base durability damage in bps before zone and defense scaling.", example = "1000")
    private int baseDamageBps;

    @Schema(description = "事件发源区域。/ Zone the event originates from.", example = "4")
    private int originZone;

    @Schema(description = "区域 i 受影响时第 i 位置 1。/ Bit i set when zone i is affected.", example = "56")
    private int affectedZonesMask;

    @Schema(description = "受影响区域 ID，升序。/ Affected zone ids, ascending.")
    private List<Integer> affectedZones;

    private long triggerBlock;

    @Schema(description = "触发事件的账户。/ Account that triggered the event.")
    private String triggeredBy;

    private EventStatus status;

    private boolean processed;

    @Schema(description = "触发时覆盖受影响区域所需的分片数。/ Shards needed to cover the affected zones at trigger time.")
    private int requiredShards;

    @Schema(description = "已处理的分片数。/ Shards processed so far.")
    private int processedShards;

    private long agentsAffected;

    private long totalDamageBps;
}
