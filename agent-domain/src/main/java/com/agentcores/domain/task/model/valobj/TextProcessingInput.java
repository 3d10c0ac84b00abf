package com.agentcores.domain.task.model.valobj;

import com.agentcores.types.enums.TaskTypeEnum;

/**
 * text_processing 输入。
 *
 * @param operation 操作名，词表在执行时校验
 * @param text 待处理文本
 */
public record TextProcessingInput(String operation, String text) implements TaskInput {

    @Override
    public TaskTypeEnum type() {
        return TaskTypeEnum.TEXT_PROCESSING;
    }
}
