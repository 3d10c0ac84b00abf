package com.agentcores.domain.auth.model.entity;

import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.UserRoleEnum;
import com.agentcores.types.exception.AppException;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 邀请领域实体。只能被接受一次。
 *
 * @author agentcores
 * @since 2026-03-03
 */
@Data
public class InvitationEntity {

    private Long id;

    /**
     * 目标租户 ID
     */
    private Long tenantId;

    /**
     * 目标邮箱
     */
    private String email;

    /**
     * 接受后获得的角色
     */
    private UserRoleEnum role;

    /**
     * 邀请令牌（随机不透明串）
     */
    private String token;

    private Long invitedBy;

    private LocalDateTime expiresAt;

    private Boolean consumed;

    private LocalDateTime consumedAt;

    private LocalDateTime createdAt;

    /**
     * 校验是否仍可接受，已使用优先于过期判断。
     */
    public void checkAcceptable(LocalDateTime now) {
        if (Boolean.TRUE.equals(consumed)) {
            throw new AppException(ResponseCode.INVITATION_CONSUMED);
        }
        if (expiresAt == null || !expiresAt.isAfter(now)) {
            throw new AppException(ResponseCode.INVITATION_EXPIRED);
        }
    }

    public boolean isPending(LocalDateTime now) {
        return !Boolean.TRUE.equals(consumed) && expiresAt != null && expiresAt.isAfter(now);
    }

    public void markConsumed(LocalDateTime now) {
        this.consumed = true;
        this.consumedAt = now;
    }
}
