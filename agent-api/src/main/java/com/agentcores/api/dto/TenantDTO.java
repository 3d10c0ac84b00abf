package com.agentcores.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 租户 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TenantDTO {

    private Long id;
    private String name;
    private String slug;
    private String tier;
    private Integer maxAgents;
    private Integer maxTasksPerHour;
    private Boolean active;
    private LocalDateTime createdAt;
}
