/**
 * Authorization 领域 - 角色权限表与授权守卫
 *
 * <p>权限表是角色到能力集合的唯一来源，后端授权与前端展示读取同一份数据。</p>
 *
 * @author agentcores
 * @since 2026-03-03
 */
package com.agentcores.domain.authorization;
