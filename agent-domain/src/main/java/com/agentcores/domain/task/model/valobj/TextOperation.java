package com.agentcores.domain.task.model.valobj;

import java.util.Locale;

/**
 * text_processing 操作词表。
 */
public enum TextOperation {

    UPPERCASE("uppercase") {
        @Override
        public Object apply(String text) {
            return text.toUpperCase(Locale.ROOT);
        }
    },

    LOWERCASE("lowercase") {
        @Override
        public Object apply(String text) {
            return text.toLowerCase(Locale.ROOT);
        }
    },

    WORD_COUNT("word_count") {
        @Override
        public Object apply(String text) {
            String trimmed = text.trim();
            return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        }
    },

    CHAR_COUNT("char_count") {
        @Override
        public Object apply(String text) {
            return text.codePointCount(0, text.length());
        }
    },

    REVERSE("reverse") {
        @Override
        public Object apply(String text) {
            return new StringBuilder(text).reverse().toString();
        }
    },

    ECHO("echo") {
        @Override
        public Object apply(String text) {
            return text;
        }
    };

    private final String code;

    TextOperation(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public abstract Object apply(String text);

    /**
     * 未知操作返回 null。
     */
    public static TextOperation fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TextOperation operation : values()) {
            if (operation.code.equalsIgnoreCase(code.trim())) {
                return operation;
            }
        }
        return null;
    }
}
