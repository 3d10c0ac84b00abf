/**
 * Task 领域 - 任务执行域
 *
 * <p>职责：任务状态机、重试与超时策略、按类型分派执行</p>
 *
 * <h3>状态机</h3>
 * <ul>
 *   <li>PENDING -&gt; RUNNING：持有租约的唯一执行者，租约时长等于 timeout_seconds</li>
 *   <li>RUNNING -&gt; COMPLETED / FAILED / CANCELLED</li>
 *   <li>FAILED -&gt; PENDING：仍有重试预算时按指数退避重新入队</li>
 *   <li>PENDING -&gt; CANCELLED：用户显式取消</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.agentcores.domain.task.model.entity.AgentTaskEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>TaskInputDomainService - 按任务类型校验输入</li>
 *   <li>TaskDispatchDomainService - 按任务类型执行，不做持久化</li>
 *   <li>TaskLifecycleDomainService - 失败处理与重试退避决策</li>
 * </ul>
 *
 * @author agentcores
 * @since 2026-03-04
 */
package com.agentcores.domain.task;
