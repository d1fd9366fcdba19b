package com.slb.chaos_engine.common.api;

import com.slb.chaos_engine.common.exception.BizException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 全局错误转换 / Runs an entry point and folds its outcome into an {@link ApiResponse}.
 * Business failures become typed error envelopes; anything else is logged and reported as 500.
 */
@Component
@Slf4j
public class GlobalErrorTranslator {

    public <T> ApiResponse<T> execute(Supplier<T> call) {
        try {
            return ApiResponse.ok(call.get());
        } catch (BizException e) {
            log.info("Engine call rejected: code={}, errorCode={}, message={}", e.getCode(), e.getMachineCode(), e.getMessage());
            return ApiResponse.error(e.getCode(), e.getMachineCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Engine call failed unexpectedly", e);
            return ApiResponse.error(500, "ENGINE_INTERNAL_ERROR", "internal error");
        }
    }

}
