package com.agentcores.domain.task.model.valobj;

import com.agentcores.types.enums.TaskTypeEnum;

import java.util.Map;

/**
 * api_call 输入。
 *
 * @param method HTTP 方法（大写）
 * @param url 绝对 http/https 地址
 * @param headers 请求头
 * @param body 请求体；Map/List 按 JSON 发送，字符串原样发送
 */
public record ApiCallInput(String method, String url, Map<String, String> headers, Object body) implements TaskInput {

    @Override
    public TaskTypeEnum type() {
        return TaskTypeEnum.API_CALL;
    }
}
