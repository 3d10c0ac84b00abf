package com.agentcores.domain.task.model.valobj;

/**
 * 工作流步骤类型
 */
public enum WorkflowStepType {

    DELAY("delay"),

    LOG("log"),

    TEXT_PROCESSING("text_processing"),

    API_CALL("api_call");

    private final String code;

    WorkflowStepType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static WorkflowStepType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkflowStepType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return null;
    }
}
