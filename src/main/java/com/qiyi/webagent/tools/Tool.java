package com.qiyi.webagent.tools;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.LinkedHashMap;

/**
 * 可通过协议调用的原子能力（“工具”）。
 *
 * <p>约定：</p>
 * <ul>
 *     <li>name/description 由 {@link Info} 注解提供，也可覆盖 getter</li>
 *     <li>execute 不向外抛出已分类失败：用 {@link ToolOutcome#fail} 表达；未分类异常由
 *     {@link ToolExecutionService} 兜底为 INTERNAL_ERROR</li>
 *     <li>所有工具都接受可选的 {@code session_id}，省略时新建会话并在结果中返回</li>
 * </ul>
 */
public interface Tool {

    String ARG_SESSION_ID = "session_id";

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.TYPE)
    @interface Info {
        String name();

        String description();
    }

    default String getName() {
        Info info = getClass().getAnnotation(Info.class);
        return info == null ? null : info.name();
    }

    default String getDescription() {
        Info info = getClass().getAnnotation(Info.class);
        return info == null ? "" : info.description();
    }

    /**
     * 入参声明（JSON Schema 风格），用于 tools/list。
     */
    default JSONObject getInputSchema() {
        return InputSchema.builder().build();
    }

    ToolOutcome execute(JSONObject arguments);

    /**
     * 入参 schema 构建器；session_id 总是第一个属性。
     */
    final class InputSchema {
        private final LinkedHashMap<String, JSONObject> properties = new LinkedHashMap<>();
        private final JSONArray required = new JSONArray();

        private InputSchema() {
            JSONObject session = new JSONObject();
            session.put("type", "string");
            session.put("description", "Existing session identifier. Leave empty to start a new session.");
            properties.put(ARG_SESSION_ID, session);
        }

        public static InputSchema builder() {
            return new InputSchema();
        }

        public InputSchema required(String name, String description) {
            properties.put(name, prop("string", description));
            required.add(name);
            return this;
        }

        public InputSchema optional(String name, String description) {
            properties.put(name, prop("string", description));
            return this;
        }

        public InputSchema optionalEnum(String name, String description, String defaultValue, String... allowed) {
            JSONObject p = prop("string", description);
            JSONArray values = new JSONArray();
            for (String a : allowed) {
                values.add(a);
            }
            p.put("enum", values);
            if (defaultValue != null) {
                p.put("default", defaultValue);
            }
            properties.put(name, p);
            return this;
        }

        public JSONObject build() {
            JSONObject schema = new JSONObject();
            schema.put("type", "object");
            JSONObject props = new JSONObject(new LinkedHashMap<>());
            props.putAll(properties);
            schema.put("properties", props);
            if (!required.isEmpty()) {
                schema.put("required", new JSONArray(required));
            }
            return schema;
        }

        private static JSONObject prop(String type, String description) {
            JSONObject p = new JSONObject();
            p.put("type", type);
            if (description != null && !description.isEmpty()) {
                p.put("description", description);
            }
            return p;
        }
    }
}
