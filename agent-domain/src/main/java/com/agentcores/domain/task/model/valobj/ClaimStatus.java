package com.agentcores.domain.task.model.valobj;

/**
 * claim 尝试的结果类型。
 */
public enum ClaimStatus {

    /** 已取得租约，状态为 RUNNING */
    CLAIMED,

    /** 租户小时配额已满，任务保持 PENDING */
    QUOTA_EXCEEDED,

    /** 仍处于重试退避期，任务保持 PENDING */
    DEFERRED,

    /** 当前状态不允许进入 RUNNING，或已被其他执行者抢先 */
    NOT_ELIGIBLE,

    /** 任务不存在或不属于当前租户 */
    NOT_FOUND
}
