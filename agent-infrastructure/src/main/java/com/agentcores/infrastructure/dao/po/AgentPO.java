package com.agentcores.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Agent PO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 租户 ID
     */
    private Long tenantId;

    /**
     * 名称（租户内唯一）
     */
    private String name;

    private String agentType;

    private String description;

    /**
     * 状态 code
     */
    private String status;

    /**
     * 配置 (JSONB)
     */
    private String configuration;

    private Long createdBy;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
