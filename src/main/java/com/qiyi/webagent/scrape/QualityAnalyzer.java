package com.qiyi.webagent.scrape;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 完整度评估。
 *
 * <p>缺失 = 值为 null 或空串。递归进入对象与数组，数组下标不进入路径（{@code a.b}）。
 * 一个条目没有任何缺失字段即为完整；完整率保留三位小数（HALF_UP）。
 * 非对象条目（标量）没有字段可查，计为完整。</p>
 */
public class QualityAnalyzer {

    public QualityReport analyze(List<?> items) {
        if (items == null || items.isEmpty()) {
            return QualityReport.empty();
        }

        Map<String, Integer> missing = new LinkedHashMap<>();
        int complete = 0;
        for (Object item : items) {
            if (walk(item, "", missing)) {
                complete++;
            }
        }

        int total = items.size();
        double rate = BigDecimal.valueOf(complete)
                .divide(BigDecimal.valueOf(total), 3, RoundingMode.HALF_UP)
                .doubleValue();

        List<String> missingFields = new ArrayList<>(missing.size());
        for (Map.Entry<String, Integer> e : missing.entrySet()) {
            missingFields.add(e.getKey() + ": " + e.getValue() + " items");
        }
        return new QualityReport(total, complete, rate, missingFields, Collections.emptyList());
    }

    /**
     * 对已结构化的数据评估：取第一个数组值作为条目列表；没有数组时视为空。
     */
    public QualityReport analyzeStructured(Map<String, ?> structured) {
        if (structured != null) {
            for (Object v : structured.values()) {
                if (v instanceof List) {
                    return analyze((List<?>) v);
                }
            }
        }
        return QualityReport.empty();
    }

    /**
     * @return 该节点下是否没有缺失字段
     */
    private static boolean walk(Object node, String prefix, Map<String, Integer> missing) {
        boolean complete = true;
        if (node instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) node).entrySet()) {
                String key = String.valueOf(e.getKey());
                String path = prefix.isEmpty() ? key : prefix + "." + key;
                Object value = e.getValue();
                if (value == null || "".equals(value)) {
                    missing.merge(path, 1, Integer::sum);
                    complete = false;
                } else if (value instanceof Map || value instanceof List) {
                    if (!walk(value, path, missing)) {
                        complete = false;
                    }
                }
            }
        } else if (node instanceof List) {
            for (Object child : (List<?>) node) {
                if (!walk(child, prefix, missing)) {
                    complete = false;
                }
            }
        }
        return complete;
    }
}
