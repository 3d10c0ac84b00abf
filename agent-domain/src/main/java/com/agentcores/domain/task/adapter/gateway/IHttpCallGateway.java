package com.agentcores.domain.task.adapter.gateway;

import com.agentcores.domain.task.model.valobj.ApiCallInput;
import com.agentcores.domain.task.model.valobj.HttpCallResult;

import java.time.Duration;

/**
 * 出站 HTTP 调用端口。
 */
public interface IHttpCallGateway {

    /**
     * 发起调用，墙钟上限为 timeout。
     *
     * @throws com.agentcores.types.exception.AppException 网络错误为 EXECUTION_ERROR，超时为 TIMEOUT
     */
    HttpCallResult call(ApiCallInput input, Duration timeout);
}
