package com.qiyi.webagent.scrape;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取并校验任务配置文件：
 * <pre>
 * {"url": "...", "schema": {...},
 *  "interactions": [{"type": "click|fill|wait|scroll", "selector"?, "value"?, "duration"?, "direction"?}],
 *  "options": {"pagination": false, "max_pages": 1}}
 * </pre>
 * 非法配置在加载阶段直接拒绝，编排器拿到的一定是合法配置。
 */
public final class ScrapeJobConfigLoader {

    private ScrapeJobConfigLoader() {
    }

    public static ScrapeJobConfig load(Path path) throws ScrapeConfigException {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ScrapeConfigException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new ScrapeConfigException("Failed to read configuration file " + path + ": " + e.getMessage(), e);
        }
        return parse(text);
    }

    public static ScrapeJobConfig parse(String text) throws ScrapeConfigException {
        Object root;
        try {
            root = JSON.parse(text);
        } catch (JSONException e) {
            throw new ScrapeConfigException("Invalid JSON in configuration file: " + e.getMessage(), e);
        }
        if (!(root instanceof JSONObject)) {
            throw new ScrapeConfigException("Configuration must be a JSON object");
        }
        JSONObject obj = (JSONObject) root;

        Object url = obj.get("url");
        if (!(url instanceof String) || ((String) url).trim().isEmpty()) {
            throw new ScrapeConfigException("'url' is required and must be a non-empty string");
        }

        Object schema = obj.get("schema");
        if (!(schema instanceof JSONObject)) {
            throw new ScrapeConfigException("'schema' is required and must be a JSON object");
        }

        List<Interaction> interactions = parseInteractions(obj.get("interactions"));

        boolean pagination = false;
        int maxPages = 1;
        Object options = obj.get("options");
        if (options != null) {
            if (!(options instanceof JSONObject)) {
                throw new ScrapeConfigException("'options' must be a JSON object");
            }
            JSONObject opts = (JSONObject) options;
            Object p = opts.get("pagination");
            if (p != null) {
                if (!(p instanceof Boolean)) {
                    throw new ScrapeConfigException("'options.pagination' must be a boolean");
                }
                pagination = (Boolean) p;
            }
            Object mp = opts.get("max_pages");
            if (mp != null) {
                Long v = asInteger(mp);
                if (v == null || v < 1 || v > Integer.MAX_VALUE) {
                    throw new ScrapeConfigException("'options.max_pages' must be a positive integer (got " + mp + ")");
                }
                maxPages = v.intValue();
            }
        }

        return new ScrapeJobConfig(((String) url).trim(), (JSONObject) schema, interactions, pagination, maxPages);
    }

    private static List<Interaction> parseInteractions(Object raw) throws ScrapeConfigException {
        List<Interaction> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        if (!(raw instanceof JSONArray)) {
            throw new ScrapeConfigException("'interactions' must be a JSON array");
        }
        JSONArray arr = (JSONArray) raw;
        for (int i = 0; i < arr.size(); i++) {
            Object item = arr.get(i);
            if (!(item instanceof JSONObject)) {
                throw new ScrapeConfigException("interactions[" + i + "] must be a JSON object");
            }
            out.add(parseInteraction(i, (JSONObject) item));
        }
        return out;
    }

    private static Interaction parseInteraction(int index, JSONObject obj) throws ScrapeConfigException {
        String where = "interactions[" + index + "]";
        Object rawType = obj.get("type");
        InteractionType type = rawType instanceof String ? InteractionType.fromWireName((String) rawType) : null;
        if (type == null) {
            throw new ScrapeConfigException(where + ": unknown interaction type '" + rawType + "'");
        }

        switch (type) {
            case CLICK:
                return Interaction.click(requireSelector(where, obj));
            case FILL: {
                String selector = requireSelector(where, obj);
                Object value = obj.get("value");
                if (value == null || value instanceof JSONObject || value instanceof JSONArray) {
                    throw new ScrapeConfigException(where + ": fill requires a 'value'");
                }
                return Interaction.fill(selector, String.valueOf(value));
            }
            case WAIT: {
                Object d = obj.get("duration");
                if (d == null) {
                    return Interaction.waitFor(Interaction.DEFAULT_WAIT_MS);
                }
                Long ms = asInteger(d);
                if (ms == null || ms < 0) {
                    throw new ScrapeConfigException(where + ": wait 'duration' must be a non-negative integer (got " + d + ")");
                }
                return Interaction.waitFor(ms);
            }
            case SCROLL: {
                Object dir = obj.get("direction");
                return Interaction.scroll(dir == null ? null : String.valueOf(dir));
            }
            default:
                throw new ScrapeConfigException(where + ": unsupported interaction type " + type);
        }
    }

    private static String requireSelector(String where, JSONObject obj) throws ScrapeConfigException {
        Object s = obj.get("selector");
        if (!(s instanceof String) || ((String) s).trim().isEmpty()) {
            throw new ScrapeConfigException(where + ": '" + obj.get("type") + "' requires a 'selector'");
        }
        return (String) s;
    }

    private static Long asInteger(Object v) {
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigDecimal) {
            BigDecimal bd = (BigDecimal) v;
            try {
                return bd.longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        if (v instanceof BigInteger) {
            try {
                return ((BigInteger) v).longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        return null;
    }
}
