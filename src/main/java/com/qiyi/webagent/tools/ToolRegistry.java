package com.qiyi.webagent.tools;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.config.AppConfig;
import com.qiyi.webagent.tools.web.ClickTool;
import com.qiyi.webagent.tools.web.ExtractLinksTool;
import com.qiyi.webagent.tools.web.FillTool;
import com.qiyi.webagent.tools.web.GetHtmlTool;
import com.qiyi.webagent.tools.web.NavigateTool;
import com.qiyi.webagent.tools.web.ScreenshotTool;
import com.qiyi.webagent.util.AppLog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工具注册与查询中心。
 *
 * <p>主要职责：</p>
 * <ul>
 *     <li>按名称注册工具实例，名称唯一，重复或非法名称拒绝注册</li>
 *     <li>按名称获取工具实例（get/contains/getAll）</li>
 *     <li>导出工具描述，用于 initialize / tools/list 响应（names/descriptors）</li>
 * </ul>
 *
 * <p>遍历顺序即注册顺序，{@link #defaults} 固定为
 * navigate、screenshot、extract_links、fill、click、get_html。</p>
 */
public class ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    /**
     * 内置浏览器工具集合，共享同一个会话管理器。
     */
    public static ToolRegistry defaults(BrowserSessionManager sessionManager, AppConfig cfg) {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new NavigateTool(sessionManager, cfg.getBrowserNavigationTimeoutMs()));
        registry.register(new ScreenshotTool(sessionManager));
        registry.register(new ExtractLinksTool(sessionManager));
        registry.register(new FillTool(sessionManager));
        registry.register(new ClickTool(sessionManager));
        registry.register(new GetHtmlTool(sessionManager));
        AppLog.info("[tool] register done, toolCount=" + registry.size());
        return registry;
    }

    /**
     * 注册单个工具实例。
     *
     * <p>以 tool name 为唯一键；当 name 缺失、抛异常或重复时将拒绝注册并返回 false。</p>
     */
    public boolean register(Tool tool) {
        if (tool == null) return false;
        String name;
        try {
            name = tool.getName();
        } catch (Exception e) {
            AppLog.warn("[tool] invalid tool name (exception), class=" + tool.getClass().getName() + ", err=" + e.getMessage());
            return false;
        }
        if (name == null || name.trim().isEmpty()) {
            AppLog.warn("[tool] invalid tool name, class=" + tool.getClass().getName());
            return false;
        }
        String n = name.trim();
        if (tools.containsKey(n)) {
            AppLog.warn("[tool] duplicated tool name ignored: " + n + ", class=" + tool.getClass().getName());
            return false;
        }
        tools.put(n, tool);
        AppLog.debug("[tool] register tool: name=" + n + ", class=" + tool.getClass().getName());
        return true;
    }

    public Tool get(String name) {
        if (name == null) return null;
        return tools.get(name);
    }

    public int size() {
        return tools.size();
    }

    public List<String> names() {
        return new ArrayList<>(tools.keySet());
    }

    public static JSONObject toDescriptor(Tool tool) {
        JSONObject obj = new JSONObject();
        if (tool == null) return obj;
        obj.put("name", tool.getName());
        obj.put("description", tool.getDescription());
        obj.put("input_schema", tool.getInputSchema());
        return obj;
    }

    public JSONArray descriptors() {
        JSONArray arr = new JSONArray();
        for (Tool t : tools.values()) {
            arr.add(toDescriptor(t));
        }
        return arr;
    }
}
