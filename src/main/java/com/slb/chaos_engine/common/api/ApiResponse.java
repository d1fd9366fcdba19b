package com.slb.chaos_engine.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一响应封装结构 / Unified result envelope for callers of the engine facade.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "统一响应结构，成功或失败均返回该结构。/ Unified result envelope returned to off-chain callers, for success and failure alike.")
public class ApiResponse<T> {

    @Schema(description = "0 表示成功，否则为类 HTTP 的失败状态码。/ 0 means success; otherwise an HTTP-like status of the failure.", example = "0")
    private int code;

    @Schema(description = "成功时为 'ok'，否则为失败原因。/ 'ok' on success, otherwise the failure reason.", example = "ok")
    private String message;

    @Schema(description = "稳定的机器错误码，仅失败时存在。/ Stable machine error code, present on failures only.", example = "EVENT_COOLDOWN", nullable = true)
    private String errorCode;

    @Schema(description = "业务数据，类型取决于调用入口。/ Payload; its type depends on the entry point.", nullable = true)
    private T data;

    private ApiResponse(int code, String message, String errorCode, T data) {
        this.code = code;
        this.message = message;
        this.errorCode = errorCode;
        this.data = data;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(0, "ok", null, data);
    }

    public static <T> ApiResponse<T> error(int code, String errorCode, String message) {
        return new ApiResponse<>(code, message, errorCode, null);
    }

    public boolean isSuccess() {
        return code == 0;
    }
}
