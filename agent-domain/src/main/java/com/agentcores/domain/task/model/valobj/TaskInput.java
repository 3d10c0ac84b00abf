package com.agentcores.domain.task.model.valobj;

import com.agentcores.types.enums.TaskTypeEnum;

/**
 * 按任务类型区分的已校验输入。每个任务类型对应一个实现。
 */
public interface TaskInput {

    TaskTypeEnum type();
}
