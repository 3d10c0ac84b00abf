package com.agentcores.domain.auth.adapter.repository;

import com.agentcores.domain.auth.model.entity.InvitationEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 邀请仓储接口
 */
public interface IInvitationRepository {

    InvitationEntity save(InvitationEntity entity);

    /**
     * 注册前按邀请令牌查询
     */
    InvitationEntity findByToken(String token);

    /**
     * 查询租户内某邮箱未过期且未使用的邀请
     */
    InvitationEntity findPendingByEmail(TenantContext context, String email, LocalDateTime now);

    /**
     * 查询租户内全部待接受邀请
     */
    List<InvitationEntity> findPending(TenantContext context, LocalDateTime now);

    /**
     * 条件标记为已使用（consumed = false 时才成功）
     */
    boolean markConsumed(Long id, LocalDateTime consumedAt);
}
