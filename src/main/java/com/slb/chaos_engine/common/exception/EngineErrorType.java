package com.slb.chaos_engine.common.exception;

/**
 * 引擎错误类型 / Catalogue of engine failure types.
 * <p>
 * Precondition failures are not retryable as-is: the caller should try again later or treat the
 * call as a no-op. None of them leaves partial state behind.
 */
public enum EngineErrorType {
    INVALID_ARGUMENT(400, "ENGINE_INVALID_ARGUMENT", "Invalid argument"),
    AGENT_NOT_FOUND(404, "AGENT_NOT_FOUND", "Agent not registered"),
    EVENT_NOT_FOUND(404, "EVENT_NOT_FOUND", "Event not found"),
    VESTING_ENTRY_NOT_FOUND(404, "VESTING_ENTRY_NOT_FOUND", "Vesting entry not found or already consumed"),
    ZONE_NOT_FOUND(404, "ZONE_NOT_FOUND", "Unknown zone"),
    OPERATOR_ALREADY_REGISTERED(409, "AGENT_OPERATOR_TAKEN", "Operator already owns an agent"),
    FIRST_MINE_DELAY(409, "MINING_FIRST_MINE_DELAY", "First-mine delay has not elapsed"),
    EVENT_COOLDOWN(409, "EVENT_COOLDOWN", "Event cooldown has not elapsed"),
    EVENT_PHASE_LOCKED(409, "EVENT_PHASE_LOCKED", "Population phase too low for events"),
    ZONE_NOT_AFFECTED(409, "EVENT_ZONE_NOT_AFFECTED", "Zone is not affected by this event"),
    SHARD_OUT_OF_RANGE(409, "EVENT_SHARD_OUT_OF_RANGE", "Shard index is outside the zone population"),
    SHARD_ALREADY_PROCESSED(409, "EVENT_SHARD_PROCESSED", "Shard already processed"),
    INSUFFICIENT_BALANCE(409, "TOKEN_INSUFFICIENT_BALANCE", "Insufficient balance"),
    NOTHING_TO_WITHDRAW(409, "VESTING_NOTHING_TO_WITHDRAW", "Nothing vested yet");

    private final int status;
    private final String code;
    private final String defaultDetail;

    EngineErrorType(int status, String code, String defaultDetail) {
        this.status = status;
        this.code = code;
        this.defaultDetail = defaultDetail;
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }
}
