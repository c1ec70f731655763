package com.qiyi.webagent.llm;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.qiyi.webagent.util.AppLog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class LlmResponseParser {

    private LlmResponseParser() {
    }

    /**
     * 取第一个 '{' 到最后一个 '}' 之间的文本解析为 JSON。
     * 对象：优先 items，其次第一个数组值，否则整体作为一个条目；解析失败返回空列表。
     */
    public static List<Object> parseItems(String responseText) {
        if (responseText == null) {
            AppLog.warn("[llm] no JSON found in completion response");
            return new ArrayList<>();
        }
        int start = responseText.indexOf('{');
        int end = responseText.lastIndexOf('}');
        if (start == -1 || end == -1 || end < start) {
            AppLog.warn("[llm] no JSON found in completion response");
            return new ArrayList<>();
        }

        Object parsed;
        try {
            parsed = JSON.parse(responseText.substring(start, end + 1));
        } catch (JSONException e) {
            AppLog.warn("[llm] failed to parse completion response as JSON: " + e.getMessage());
            AppLog.debug("[llm] response text: " + responseText);
            return new ArrayList<>();
        }

        if (parsed instanceof JSONObject) {
            JSONObject obj = (JSONObject) parsed;
            if (obj.containsKey("items")) {
                Object items = obj.get("items");
                if (items instanceof JSONArray) {
                    return new ArrayList<>((JSONArray) items);
                }
                List<Object> single = new ArrayList<>();
                if (items != null) {
                    single.add(items);
                }
                return single;
            }
            for (Object v : obj.values()) {
                if (v instanceof JSONArray) {
                    return new ArrayList<>((JSONArray) v);
                }
            }
            List<Object> single = new ArrayList<>();
            single.add(obj);
            return single;
        }
        if (parsed instanceof JSONArray) {
            return new ArrayList<>((JSONArray) parsed);
        }
        return new ArrayList<>();
    }

    /**
     * 去掉 ``` 代码块标记与包裹整个选择器的单对反引号。
     */
    public static String cleanSelector(String raw) {
        if (raw == null) {
            return "";
        }
        String selector = raw.trim();
        if (selector.startsWith("```")) {
            List<String> lines = new ArrayList<>(Arrays.asList(selector.split("\n", -1)));
            if (!lines.isEmpty() && lines.get(0).startsWith("```")) {
                lines.remove(0);
            }
            if (!lines.isEmpty() && lines.get(lines.size() - 1).trim().equals("```")) {
                lines.remove(lines.size() - 1);
            }
            selector = String.join("\n", lines).trim();
        }
        if (selector.length() >= 2 && selector.startsWith("`") && selector.endsWith("`")
                && selector.chars().filter(c -> c == '`').count() == 2) {
            selector = selector.substring(1, selector.length() - 1).trim();
        }
        return selector;
    }
}
