/**
 * Agent 领域 - 租户内的 Agent 注册表
 *
 * @author agentcores
 * @since 2026-03-03
 */
package com.agentcores.domain.agent;
