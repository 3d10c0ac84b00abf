package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Map;

/**
 * 任务创建请求 DTO。priority 接受 0..10 整数或 low/normal/high/urgent。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaskCreateRequestDTO {

    private Long agentId;
    private String taskType;
    private Object priority;
    private Map<String, Object> inputData;
    private Integer maxRetries;
    private Integer timeoutSeconds;
}
