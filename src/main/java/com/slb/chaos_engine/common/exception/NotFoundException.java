package com.slb.chaos_engine.common.exception;

public class NotFoundException extends BizException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(EngineErrorType errorType, String message) {
        super(errorType, message);
    }

    public static NotFoundException agent(long agentId) {
        return new NotFoundException(EngineErrorType.AGENT_NOT_FOUND, "agent " + agentId + " not registered");
    }

    public static NotFoundException event(long eventId) {
        return new NotFoundException(EngineErrorType.EVENT_NOT_FOUND, "event " + eventId + " not found");
    }

    public static NotFoundException vestingEntry(long entryId) {
        return new NotFoundException(EngineErrorType.VESTING_ENTRY_NOT_FOUND, "vesting entry " + entryId + " not found");
    }

    public static NotFoundException zone(int zoneId) {
        return new NotFoundException(EngineErrorType.ZONE_NOT_FOUND, "zone " + zoneId + " is not configured");
    }
}
