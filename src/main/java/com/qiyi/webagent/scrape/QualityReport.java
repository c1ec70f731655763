package com.qiyi.webagent.scrape;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 抽取结果的完整度报告。
 */
public final class QualityReport {
    private final int totalItems;
    private final int completeItems;
    private final double completionRate;
    private final List<String> missingFields;
    private final List<String> errors;

    public QualityReport(int totalItems, int completeItems, double completionRate,
                         List<String> missingFields, List<String> errors) {
        this.totalItems = totalItems;
        this.completeItems = completeItems;
        this.completionRate = completionRate;
        this.missingFields = missingFields == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(missingFields));
        this.errors = errors == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static QualityReport empty() {
        return new QualityReport(0, 0, 0.0, null, null);
    }

    public int getTotalItems() {
        return totalItems;
    }

    public int getCompleteItems() {
        return completeItems;
    }

    public double getCompletionRate() {
        return completionRate;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }

    public List<String> getErrors() {
        return errors;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("total_items", totalItems);
        obj.put("complete_items", completeItems);
        obj.put("completion_rate", completionRate);
        obj.put("missing_fields", new JSONArray(missingFields));
        obj.put("errors", new JSONArray(errors));
        return obj;
    }
}
