package com.qiyi.webagent.scrape;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.qiyi.webagent.config.AppConfig;
import com.qiyi.webagent.llm.CompletionService;
import com.qiyi.webagent.tools.Tool;
import com.qiyi.webagent.tools.ToolCallResult;
import com.qiyi.webagent.tools.ToolError;
import com.qiyi.webagent.tools.ToolErrorCode;
import com.qiyi.webagent.tools.ToolExecutionService;
import com.qiyi.webagent.util.AppLog;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 抓取编排器：导航 → 预置交互 → 抽取/翻页循环 → 结构化 → 评分。
 *
 * <p>状态流转：START → NAVIGATED → INTERACTED → EXTRACTING → STRUCTURED → SCORED → DONE，
 * 任一步骤出现致命错误进入 ERROR，结果中不带部分数据。</p>
 *
 * <p>致命与可容忍：</p>
 * <ul>
 *     <li>导航失败、get_html 失败、补全服务不可用：致命</li>
 *     <li>预置交互中的 click/fill 失败：记录告警后继续</li>
 *     <li>翻页点击失败：视为最后一页，停止翻页</li>
 * </ul>
 *
 * <p>浏览器会话由每个任务的 navigate 调用新建，只在该任务内使用；同一实例可顺序执行多个任务。</p>
 */
public class ScrapingOrchestrator {
    public static final String DEFAULT_ARRAY_FIELD = "items";
    public static final String METADATA_FIELD = "metadata";

    private final ToolExecutionService tools;
    private final CompletionService completion;
    private final QualityAnalyzer analyzer;
    private final Settings settings;
    private final Clock clock;

    public ScrapingOrchestrator(ToolExecutionService tools, CompletionService completion,
                                QualityAnalyzer analyzer, Settings settings) {
        this(tools, completion, analyzer, settings, Clock.systemUTC());
    }

    public ScrapingOrchestrator(ToolExecutionService tools, CompletionService completion,
                                QualityAnalyzer analyzer, Settings settings, Clock clock) {
        this.tools = tools;
        this.completion = completion;
        this.analyzer = analyzer;
        this.settings = settings == null ? Settings.defaults() : settings;
        this.clock = clock;
    }

    public ExtractionResult run(ScrapeJobConfig config) {
        Job job = new Job(config);
        AppLog.info("[scrape] job begin: url=" + config.getUrl()
                + ", pagination=" + config.isPagination() + ", maxPages=" + config.getMaxPages());
        try {
            navigate(job);
            runInteractions(job);
            List<Object> items = extractPages(job);

            JSONObject data = structure(items, config.getSchema());
            job.transition(JobState.STRUCTURED);

            QualityReport report = analyzer.analyzeStructured(data);
            job.transition(JobState.SCORED);

            job.transition(JobState.DONE);
            AppLog.info("[scrape] job done: pages=" + job.pages + ", items=" + report.getTotalItems()
                    + ", completionRate=" + report.getCompletionRate());
            return ExtractionResult.success(data, report, job.pages);
        } catch (StepFailedException e) {
            job.transition(JobState.ERROR);
            AppLog.warn("[scrape] job failed: step=" + e.step + ", err=" + e.getMessage());
            return ExtractionResult.error(e.getMessage(), job.pages);
        } catch (Exception e) {
            job.transition(JobState.ERROR);
            AppLog.error("[scrape] job failed: " + e.getMessage(), e);
            String msg = e.getMessage();
            return ExtractionResult.error(msg == null || msg.isEmpty() ? e.getClass().getSimpleName() : msg, job.pages);
        }
    }

    private void navigate(Job job) {
        JSONObject args = new JSONObject();
        args.put("url", job.config.getUrl());
        ToolCallResult res = tools.call("navigate", args);
        if (!res.isOk()) {
            throw new StepFailedException("navigate", res.getError());
        }
        job.sessionId = res.getSessionId();
        AppLog.info("[scrape] navigated: url=" + job.config.getUrl() + ", session=" + job.sessionId);
        job.transition(JobState.NAVIGATED);
    }

    private void runInteractions(Job job) {
        for (Interaction interaction : job.config.getInteractions()) {
            switch (interaction.getType()) {
                case CLICK: {
                    JSONObject args = job.args();
                    args.put("selector", interaction.getSelector());
                    ToolCallResult res = tools.call("click", args);
                    if (res.isOk()) {
                        AppLog.info("[scrape] clicked: selector=" + interaction.getSelector());
                    } else {
                        AppLog.warn("[scrape] click failed: selector=" + interaction.getSelector() + ", err=" + res.getError());
                    }
                    break;
                }
                case FILL: {
                    JSONObject args = job.args();
                    args.put("selector", interaction.getSelector());
                    args.put("value", interaction.getValue());
                    ToolCallResult res = tools.call("fill", args);
                    if (res.isOk()) {
                        AppLog.info("[scrape] filled: selector=" + interaction.getSelector());
                    } else {
                        AppLog.warn("[scrape] fill failed: selector=" + interaction.getSelector() + ", err=" + res.getError());
                    }
                    break;
                }
                case WAIT:
                    pause(interaction.getDurationMs());
                    AppLog.info("[scrape] waited: ms=" + interaction.getDurationMs());
                    break;
                case SCROLL:
                    AppLog.warn("[scrape] scroll not supported, skipping: direction=" + interaction.getDirection());
                    break;
                default:
                    throw new IllegalStateException("Unhandled interaction type: " + interaction.getType());
            }
        }
        job.transition(JobState.INTERACTED);
    }

    private List<Object> extractPages(Job job) {
        job.transition(JobState.EXTRACTING);
        ScrapeJobConfig config = job.config;
        List<Object> all = new ArrayList<>();

        while (job.pages < config.getMaxPages()) {
            job.pages++;
            AppLog.info("[scrape] extracting page " + job.pages);

            ToolCallResult htmlRes = tools.call("get_html", job.args());
            if (!htmlRes.isOk()) {
                throw new StepFailedException("get_html", htmlRes.getError());
            }
            String html = htmlRes.getData().getString("html");
            if (html == null) {
                html = "";
            }

            List<Object> pageItems = completion.extractItems(truncate(html, settings.htmlMaxChars), config.getSchema());
            if (pageItems != null) {
                all.addAll(pageItems);
            }

            if (!config.isPagination() || job.pages >= config.getMaxPages()) {
                break;
            }
            if (!nextPage(job, html)) {
                AppLog.info("[scrape] no more pages to scrape");
                break;
            }
        }
        return all;
    }

    /**
     * @return 是否已成功翻到下一页
     */
    private boolean nextPage(Job job, String html) {
        String selector = completion.findNextPageSelector(truncate(html, settings.paginationHtmlMaxChars));
        selector = selector == null ? "" : selector.trim();
        if (selector.isEmpty() || CompletionService.NO_PAGINATION.equals(selector)) {
            return false;
        }

        AppLog.info("[scrape] attempting pagination: selector=" + selector);
        JSONObject args = job.args();
        args.put("selector", selector);
        ToolCallResult res = tools.call("click", args);
        if (!res.isOk()) {
            ToolErrorCode code = res.getError().getCode();
            if (code == ToolErrorCode.ELEMENT_NOT_VISIBLE || code == ToolErrorCode.ELEMENT_NOT_CLICKABLE) {
                AppLog.info("[scrape] pagination element not accessible (" + code + "), likely on last page");
            } else {
                AppLog.warn("[scrape] failed to navigate to next page: " + res.getError());
            }
            return false;
        }

        AppLog.info("[scrape] navigated to next page: selector=" + selector);
        pause(settings.settleMs);
        return true;
    }

    JSONObject structure(List<Object> items, JSONObject schema) {
        String arrayField = DEFAULT_ARRAY_FIELD;
        for (Map.Entry<String, Object> e : schema.entrySet()) {
            Object v = e.getValue();
            if (v instanceof List && !((List<?>) v).isEmpty()) {
                arrayField = e.getKey();
                break;
            }
        }

        JSONObject data = new JSONObject();
        data.put(arrayField, new JSONArray(items));
        if (schema.containsKey(METADATA_FIELD)) {
            JSONObject metadata = new JSONObject();
            metadata.put("date_extraction", Instant.now(clock).toString());
            metadata.put("nb_resultats", items.size());
            data.put(METADATA_FIELD, metadata);
        }
        return data;
    }

    /**
     * 阻塞等待；测试覆盖为空实现。
     */
    protected void pause(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting", e);
        }
    }

    static String truncate(String s, int maxChars) {
        if (s == null) return "";
        return s.length() > maxChars ? s.substring(0, maxChars) : s;
    }

    /**
     * 单个任务的可变状态，不跨任务共享。
     */
    private static final class Job {
        final ScrapeJobConfig config;
        JobState state = JobState.START;
        String sessionId;
        int pages = 0;

        Job(ScrapeJobConfig config) {
            this.config = config;
        }

        JSONObject args() {
            JSONObject args = new JSONObject();
            args.put(Tool.ARG_SESSION_ID, sessionId);
            return args;
        }

        void transition(JobState next) {
            if (state == JobState.ERROR) return;
            AppLog.debug("[scrape] state " + state + " -> " + next);
            state = next;
        }
    }

    /**
     * 工具步骤的致命失败；消息为 {@code CODE: message}。
     */
    private static final class StepFailedException extends RuntimeException {
        final String step;

        StepFailedException(String step, ToolError error) {
            super(String.valueOf(error));
            this.step = step;
        }
    }

    /**
     * 编排相关的可调参数。
     */
    public static final class Settings {
        final int htmlMaxChars;
        final int paginationHtmlMaxChars;
        final long settleMs;

        public Settings(int htmlMaxChars, int paginationHtmlMaxChars, long settleMs) {
            this.htmlMaxChars = htmlMaxChars;
            this.paginationHtmlMaxChars = paginationHtmlMaxChars;
            this.settleMs = settleMs;
        }

        public static Settings defaults() {
            return new Settings(AppConfig.DEFAULT_SCRAPE_HTML_MAX_CHARS,
                    AppConfig.DEFAULT_SCRAPE_PAGINATION_HTML_MAX_CHARS,
                    AppConfig.DEFAULT_SCRAPE_PAGINATION_SETTLE_MS);
        }

        public static Settings fromConfig(AppConfig cfg) {
            return new Settings(cfg.getScrapeHtmlMaxChars(), cfg.getScrapePaginationHtmlMaxChars(),
                    cfg.getScrapePaginationSettleMs());
        }
    }
}
