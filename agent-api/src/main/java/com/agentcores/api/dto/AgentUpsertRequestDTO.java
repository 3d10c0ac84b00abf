package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Map;

/**
 * Agent 创建 / 更新请求 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentUpsertRequestDTO {

    private String name;
    private String agentType;
    private String description;
    private String status;
    private Map<String, Object> configuration;
}
