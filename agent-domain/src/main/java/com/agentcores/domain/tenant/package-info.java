/**
 * Tenant 领域 - 组织与配额
 *
 * <p>职责：租户信息、订阅等级对应的资源上限</p>
 *
 * @author agentcores
 * @since 2026-03-03
 */
package com.agentcores.domain.tenant;
