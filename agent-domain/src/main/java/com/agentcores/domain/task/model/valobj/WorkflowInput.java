package com.agentcores.domain.task.model.valobj;

import com.agentcores.types.enums.TaskTypeEnum;

import java.util.List;

/**
 * workflow 输入：有序步骤列表。
 */
public record WorkflowInput(List<WorkflowStep> steps) implements TaskInput {

    @Override
    public TaskTypeEnum type() {
        return TaskTypeEnum.WORKFLOW;
    }
}
