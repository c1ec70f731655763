package com.qiyi.webagent.tools;

import com.alibaba.fastjson2.JSONObject;
import com.qiyi.webagent.util.AppLog;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 工具执行服务：按名称查找工具、计时、把任何结果或异常统一成 {@link ToolCallResult}。
 *
 * <p>调用方永远拿到一个结果对象，本类不向外抛出工具异常。每次调用输出一条
 * {@code tool_success} / {@code tool_failure} 结构化日志。</p>
 */
public class ToolExecutionService {
    public static final String EVENT_SUCCESS = "tool_success";
    public static final String EVENT_FAILURE = "tool_failure";

    private final ToolRegistry registry;
    private final Clock clock;

    public ToolExecutionService(ToolRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public ToolExecutionService(ToolRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    public ToolCallResult call(String name, JSONObject arguments) {
        Tool tool = registry.get(name);
        if (tool == null) {
            ToolCallResult result = ToolCallResult.failure(name, null,
                    ToolError.of(ToolErrorCode.INTERNAL_ERROR, "Unknown tool: " + name), now(), 0L);
            logOutcome(result);
            return result;
        }

        // 工具拿到的是副本，调用方对象不被修改
        JSONObject args = arguments == null ? new JSONObject() : new JSONObject(arguments);
        String requestedSession = args.getString(Tool.ARG_SESSION_ID);

        long started = System.nanoTime();
        ToolOutcome outcome;
        try {
            outcome = tool.execute(args);
            if (outcome == null) {
                outcome = ToolOutcome.fail(requestedSession,
                        ToolError.of(ToolErrorCode.INTERNAL_ERROR, "Tool returned no result"));
            }
        } catch (ToolException e) {
            outcome = ToolOutcome.fail(requestedSession, e.toError());
        } catch (Exception | LinkageError e) {
            AppLog.error("[tool] unexpected failure: tool=" + name, e);
            outcome = ToolOutcome.fail(requestedSession, ToolError.from(e));
        }
        long durationMs = (System.nanoTime() - started) / 1_000_000L;

        ToolCallResult result;
        if (outcome.isOk()) {
            result = ToolCallResult.success(name, outcome.getSessionId(), outcome.getData(), now(), durationMs);
        } else {
            // 失败时仅回显调用方传入的 session_id
            result = ToolCallResult.failure(name, requestedSession, outcome.getError(), now(), durationMs);
        }
        logOutcome(result);
        return result;
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static void logOutcome(ToolCallResult result) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("tool", result.getTool());
        fields.put("session_id", result.getSessionId());
        fields.put("ok", result.isOk());
        if (result.isOk()) {
            fields.put("duration_ms", result.getDurationMs());
            Object url = result.getData() == null ? null : result.getData().get("current_url");
            if (url != null) {
                fields.put("url", url);
            }
            AppLog.event(EVENT_SUCCESS, fields);
        } else {
            fields.put("error_code", result.getError().getCode().name());
            fields.put("duration_ms", result.getDurationMs());
            AppLog.event(EVENT_FAILURE, fields);
        }
    }
}
