package com.agentcores.domain.task.model.valobj;

/**
 * 工作流步骤。
 *
 * @param name 步骤名，缺省为 step-序号
 * @param type 步骤类型
 * @param delaySeconds delay 步骤的等待秒数
 * @param message log 步骤的消息
 * @param nested text_processing / api_call 步骤的嵌套输入
 */
public record WorkflowStep(String name,
                           WorkflowStepType type,
                           Double delaySeconds,
                           String message,
                           TaskInput nested) {
}
