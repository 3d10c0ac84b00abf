package com.agentcores.domain.task.model.valobj;

/**
 * 出站 HTTP 调用结果。
 *
 * @param statusCode 上游状态码
 * @param body 响应体（可能已截断）
 * @param json 响应体为 JSON 时的解析结果，否则为 null
 * @param truncated 响应体是否被截断
 */
public record HttpCallResult(int statusCode, String body, Object json, boolean truncated) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 400;
    }
}
