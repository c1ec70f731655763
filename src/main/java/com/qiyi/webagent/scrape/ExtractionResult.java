package com.qiyi.webagent.scrape;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;

/**
 * 一次抓取任务的最终结果，对应结果文件 {@code {status, data, quality_report, error?}}。
 */
public final class ExtractionResult {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private final String status;
    private final JSONObject data;
    private final QualityReport qualityReport;
    private final String error;
    private final int pagesProcessed;

    private ExtractionResult(String status, JSONObject data, QualityReport qualityReport, String error, int pagesProcessed) {
        this.status = status;
        this.data = data == null ? new JSONObject() : snapshot(data);
        this.qualityReport = qualityReport;
        this.error = error;
        this.pagesProcessed = pagesProcessed;
    }

    public static ExtractionResult success(JSONObject data, QualityReport report, int pagesProcessed) {
        return new ExtractionResult(STATUS_SUCCESS, data, report == null ? QualityReport.empty() : report, null, pagesProcessed);
    }

    /**
     * 失败结果不带任何部分数据：data 与 quality_report 均为空对象。
     */
    public static ExtractionResult error(String message, int pagesProcessed) {
        return new ExtractionResult(STATUS_ERROR, new JSONObject(), null,
                message == null || message.isEmpty() ? "Unknown error" : message, pagesProcessed);
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    public String getStatus() {
        return status;
    }

    /**
     * 返回数据的深拷贝，结果本身生成后不可变。
     */
    public JSONObject getData() {
        return snapshot(data);
    }

    /**
     * 失败结果返回 null。
     */
    public QualityReport getQualityReport() {
        return qualityReport;
    }

    public String getError() {
        return error;
    }

    public int getPagesProcessed() {
        return pagesProcessed;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("status", status);
        obj.put("data", snapshot(data));
        obj.put("quality_report", qualityReport == null ? new JSONObject() : qualityReport.toJson());
        if (error != null) {
            obj.put("error", error);
        }
        return obj;
    }

    private static JSONObject snapshot(JSONObject source) {
        return JSON.parseObject(JSON.toJSONString(source, JSONWriter.Feature.WriteMapNullValue));
    }
}
