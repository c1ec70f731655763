package com.qiyi.webagent.llm;

import java.util.Collections;
import java.util.Map;

public class LLMResult {
    private final boolean success;
    private final String text;
    private final String model;
    private final Map<String, Object> usage;
    private final String error;

    private LLMResult(boolean success, String text, String model, Map<String, Object> usage, String error) {
        this.success = success;
        this.text = text == null ? "" : text;
        this.model = model;
        this.usage = usage == null ? null : Collections.unmodifiableMap(usage);
        this.error = error;
    }

    public static LLMResult ok(String text, String model, Map<String, Object> usage) {
        return new LLMResult(true, text, model, usage, null);
    }

    public static LLMResult fail(String model, String error) {
        return new LLMResult(false, "", model, null, error == null ? "" : error);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getText() {
        return text;
    }

    public String getModel() {
        return model;
    }

    public Map<String, Object> getUsage() {
        return usage;
    }

    public String getError() {
        return error;
    }
}
