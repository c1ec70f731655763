package com.qiyi.webagent.agent;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import com.qiyi.webagent.browser.PlaywrightSessionManager;
import com.qiyi.webagent.config.AppConfig;
import com.qiyi.webagent.llm.LlmClient;
import com.qiyi.webagent.llm.LlmCompletionService;
import com.qiyi.webagent.scrape.ExtractionResult;
import com.qiyi.webagent.scrape.QualityAnalyzer;
import com.qiyi.webagent.scrape.QualityReport;
import com.qiyi.webagent.scrape.ScrapeConfigException;
import com.qiyi.webagent.scrape.ScrapeJobConfig;
import com.qiyi.webagent.scrape.ScrapeJobConfigLoader;
import com.qiyi.webagent.scrape.ScrapingOrchestrator;
import com.qiyi.webagent.tools.ToolExecutionService;
import com.qiyi.webagent.tools.ToolRegistry;
import com.qiyi.webagent.util.AppLog;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * 抓取任务命令行入口。
 *
 * <pre>
 * ScrapeCliAgent --config job.json [--output scraping_result.json] [--api-key sk-xxx] [--verbose]
 * </pre>
 *
 * <p>退出码：成功 0；缺少 API Key、配置非法或任务失败为 1。任务开始后总会写出结果文件。</p>
 */
public class ScrapeCliAgent {
    public static final String DEFAULT_OUTPUT = "scraping_result.json";

    /**
     * 真正执行任务的部分，测试中替换掉以避免启动浏览器。
     */
    public interface JobRunner {
        ExtractionResult run(ScrapeJobConfig config, String apiKey);
    }

    static final class Options {
        String config;
        String output = DEFAULT_OUTPUT;
        String apiKey;
        boolean verbose;
        boolean help;
    }

    private final AppConfig cfg;
    private final JobRunner runner;
    private final PrintStream err;

    public ScrapeCliAgent(AppConfig cfg, JobRunner runner, PrintStream err) {
        this.cfg = cfg;
        this.runner = runner;
        this.err = err;
    }

    public int execute(String[] args) {
        Options opts;
        try {
            opts = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            printUsage();
            return 1;
        }
        if (opts.help) {
            printUsage();
            return 0;
        }
        if (opts.verbose) {
            AppLog.setVerbose(true);
        }

        String apiKey = opts.apiKey != null ? opts.apiKey : cfg.getLlmApiKey();
        if (apiKey == null || apiKey.trim().isEmpty()) {
            err.println("ERROR: OpenAI API key not provided");
            err.println("Set OPENAI_API_KEY environment variable or use --api-key");
            return 1;
        }

        ScrapeJobConfig config;
        try {
            config = ScrapeJobConfigLoader.load(Paths.get(opts.config));
        } catch (ScrapeConfigException e) {
            err.println("ERROR: " + e.getMessage());
            return 1;
        }

        err.println("Starting scraping job for: " + config.getUrl());
        err.println("Output will be saved to: " + opts.output);

        ExtractionResult result = runner.run(config, apiKey);

        Path output = Paths.get(opts.output);
        try {
            writeResult(output, result);
        } catch (IOException e) {
            AppLog.error("[scrape] failed to write result file: " + output, e);
            err.println("ERROR: Failed to write results to " + output + ": " + e.getMessage());
            return 1;
        }

        if (result.isSuccess()) {
            QualityReport report = result.getQualityReport();
            err.println("Scraping completed successfully!");
            err.println("Results saved to: " + output);
            err.println("Summary:");
            err.println("  - Total items: " + report.getTotalItems());
            err.println("  - Completion rate: "
                    + String.format(Locale.ROOT, "%.1f%%", report.getCompletionRate() * 100));
            return 0;
        }
        err.println("Scraping failed: " + result.getError());
        err.println("Partial results saved to: " + output);
        return 1;
    }

    static Options parseArgs(String[] args) {
        Options opts = new Options();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--config":
                    opts.config = requireValue(args, ++i, a);
                    break;
                case "--output":
                    opts.output = requireValue(args, ++i, a);
                    break;
                case "--api-key":
                    opts.apiKey = requireValue(args, ++i, a);
                    break;
                case "--verbose":
                    opts.verbose = true;
                    break;
                case "-h":
                case "--help":
                    opts.help = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown argument: " + a);
            }
        }
        if (!opts.help && (opts.config == null || opts.config.trim().isEmpty())) {
            throw new IllegalArgumentException("--config is required");
        }
        return opts;
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    static void writeResult(Path output, ExtractionResult result) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = JSON.toJSONString(result.toJson(), JSONWriter.Feature.PrettyFormat, JSONWriter.Feature.WriteMapNullValue);
        Files.writeString(output, json, StandardCharsets.UTF_8);
    }

    private void printUsage() {
        err.println("Usage: ScrapeCliAgent --config <file> [--output <file>] [--api-key <key>] [--verbose]");
        err.println("  --config    Path to JSON job configuration file (required)");
        err.println("  --output    Output file for results (default: " + DEFAULT_OUTPUT + ")");
        err.println("  --api-key   OpenAI API key (or set OPENAI_API_KEY)");
        err.println("  --verbose   Enable debug logging");
    }

    /**
     * 用真实浏览器与补全服务执行一次任务，结束后释放浏览器。
     */
    static ExtractionResult runWithBrowser(AppConfig cfg, ScrapeJobConfig config, String apiKey) {
        PlaywrightSessionManager sessionManager = PlaywrightSessionManager.fromConfig(cfg);
        try {
            ToolExecutionService tools = new ToolExecutionService(ToolRegistry.defaults(sessionManager, cfg));
            LlmCompletionService completion = new LlmCompletionService(LlmClient.fromConfig(cfg, apiKey));
            ScrapingOrchestrator orchestrator = new ScrapingOrchestrator(tools, completion, new QualityAnalyzer(),
                    ScrapingOrchestrator.Settings.fromConfig(cfg));
            return orchestrator.run(config);
        } finally {
            sessionManager.shutdown();
        }
    }

    public static void main(String[] args) {
        AppConfig cfg = AppConfig.getInstance();
        ScrapeCliAgent cli = new ScrapeCliAgent(cfg, (config, apiKey) -> runWithBrowser(cfg, config, apiKey), System.err);
        System.exit(cli.execute(args));
    }
}
