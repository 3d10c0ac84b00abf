package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 任务详情 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaskDetailDTO {

    private Long id;
    private Long tenantId;
    private Long agentId;
    private String taskType;
    private Integer priority;
    private String status;
    private Map<String, Object> inputData;
    private Map<String, Object> outputData;
    private Integer retryCount;
    private Integer maxRetries;
    private Integer timeoutSeconds;
    private String lastError;
    private LocalDateTime nextRunAt;
    private Boolean cancelRequested;
    private Long createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
