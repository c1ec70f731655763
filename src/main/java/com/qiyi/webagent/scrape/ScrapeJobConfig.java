package com.qiyi.webagent.scrape;

import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次抓取任务的配置：目标 URL、期望的数据 schema、预置交互与翻页选项。
 */
public final class ScrapeJobConfig {
    private final String url;
    private final JSONObject schema;
    private final List<Interaction> interactions;
    private final boolean pagination;
    private final int maxPages;

    public ScrapeJobConfig(String url, JSONObject schema, List<Interaction> interactions, boolean pagination, int maxPages) {
        if (url == null || url.trim().isEmpty()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        if (maxPages < 1) {
            throw new IllegalArgumentException("max_pages must be >= 1, got " + maxPages);
        }
        this.url = url;
        this.schema = schema == null ? new JSONObject() : schema;
        this.interactions = interactions == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(interactions));
        this.pagination = pagination;
        this.maxPages = maxPages;
    }

    public static ScrapeJobConfig of(String url, JSONObject schema) {
        return new ScrapeJobConfig(url, schema, null, false, 1);
    }

    public String getUrl() {
        return url;
    }

    public JSONObject getSchema() {
        return schema;
    }

    public List<Interaction> getInteractions() {
        return interactions;
    }

    public boolean isPagination() {
        return pagination;
    }

    public int getMaxPages() {
        return maxPages;
    }
}
