package com.slb.chaos_engine.common.exception;

/**
 * State did not allow the transition. Nothing was written.
 */
public class PreconditionException extends BizException {

    private static final long serialVersionUID = 1L;

    public PreconditionException(EngineErrorType errorType, String message) {
        super(errorType, message);
    }
}
