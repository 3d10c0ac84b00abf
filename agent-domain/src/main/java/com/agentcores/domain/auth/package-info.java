/**
 * Auth 领域 - 身份与会话
 *
 * <p>职责：凭证校验、访问/刷新令牌签发与轮换、邀请接受、租户上下文解析</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>TenantContext：每个已认证请求唯一且不可变的租户上下文，所有租户数据访问的必填参数</li>
 *   <li>Token Family：一次登录派生出的刷新令牌链，检测到重放时整族吊销</li>
 * </ul>
 *
 * @author agentcores
 * @since 2026-03-03
 */
package com.agentcores.domain.auth;
