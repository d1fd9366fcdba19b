package com.slb.chaos_engine.common.exception;

/**
 * 业务异常基类 / Root of every business failure raised by the engine.
 * <p>
 * {@code code} keeps HTTP semantics so a transport can map it directly; {@code errorType}
 * carries the stable machine code callers branch on.
 */
public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int code;
    private final EngineErrorType errorType;

    public BizException(EngineErrorType errorType, String message) {
        super(message != null ? message : errorType.getDefaultDetail());
        this.code = errorType.getStatus();
        this.errorType = errorType;
    }

    public int getCode() {
        return code;
    }

    public EngineErrorType getErrorType() {
        return errorType;
    }

    public String getMachineCode() {
        return errorType.getCode();
    }
}
