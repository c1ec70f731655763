package com.qiyi.webagent.config;

import com.qiyi.webagent.util.AppLog;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * 进程级配置。
 *
 * <p>读取顺序：System Property → 环境变量（仅 API Key）→ classpath 下的 {@code webagent.cfg} → 默认值。</p>
 */
public class AppConfig {
    private static final AppConfig INSTANCE = new AppConfig(loadDefaultProperties());

    public static final String CONFIG_RESOURCE = "webagent.cfg";

    // Configuration Keys
    public static final String KEY_LLM_API_KEY = "llm.api-key";
    public static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    public static final String KEY_LLM_BASE_URL = "llm.base-url";
    public static final String KEY_LLM_MODEL = "llm.model";
    public static final String KEY_LLM_HTTP_TIMEOUT_SECONDS = "llm.http.timeout.seconds";
    public static final String KEY_LLM_HTTP_RETRY_MAX_ATTEMPTS = "llm.http.retry.max-attempts";
    public static final String KEY_LLM_HTTP_RETRY_BACKOFF_MS = "llm.http.retry.backoff.ms";
    public static final String KEY_BROWSER_HEADLESS = "browser.headless";
    public static final String KEY_BROWSER_NAVIGATION_TIMEOUT_MS = "browser.navigation.timeout.ms";
    public static final String KEY_SCRAPE_HTML_MAX_CHARS = "scrape.html.max-chars";
    public static final String KEY_SCRAPE_PAGINATION_HTML_MAX_CHARS = "scrape.pagination.html.max-chars";
    public static final String KEY_SCRAPE_PAGINATION_SETTLE_MS = "scrape.pagination.settle.ms";

    // Default Values
    public static final String DEFAULT_LLM_BASE_URL = "https://api.openai.com/v1/chat/completions";
    public static final String DEFAULT_LLM_MODEL = "gpt-4o";
    public static final int DEFAULT_LLM_HTTP_TIMEOUT_SECONDS = 120;
    public static final int DEFAULT_LLM_HTTP_RETRY_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_LLM_HTTP_RETRY_BACKOFF_MS = 600;
    public static final boolean DEFAULT_BROWSER_HEADLESS = true;
    public static final int DEFAULT_BROWSER_NAVIGATION_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_SCRAPE_HTML_MAX_CHARS = 50_000;
    public static final int DEFAULT_SCRAPE_PAGINATION_HTML_MAX_CHARS = 30_000;
    public static final long DEFAULT_SCRAPE_PAGINATION_SETTLE_MS = 2_000;

    private final Properties properties;

    public AppConfig(Properties properties) {
        this.properties = properties == null ? new Properties() : properties;
    }

    public static AppConfig getInstance() {
        return INSTANCE;
    }

    private static Properties loadDefaultProperties() {
        Properties props = new Properties();
        try (InputStream input = AppConfig.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (input == null) {
                AppLog.warn("[config] " + CONFIG_RESOURCE + " not found on classpath, using defaults");
                return props;
            }
            props.load(input);
        } catch (IOException ex) {
            AppLog.error("[config] failed to load " + CONFIG_RESOURCE, ex);
        }
        return props;
    }

    public String getProperty(String key) {
        String sys = System.getProperty(key);
        if (sys != null && !sys.trim().isEmpty()) {
            return sys.trim();
        }
        String v = properties.getProperty(key);
        return v == null ? null : v.trim();
    }

    public String getProperty(String key, String defaultValue) {
        String v = getProperty(key);
        return v == null || v.isEmpty() ? defaultValue : v;
    }

    public String getLlmApiKey() {
        String v = System.getProperty(KEY_LLM_API_KEY);
        if (v == null || v.trim().isEmpty()) {
            v = System.getenv(ENV_OPENAI_API_KEY);
        }
        if (v == null || v.trim().isEmpty()) {
            v = properties.getProperty(KEY_LLM_API_KEY);
        }
        return v == null || v.trim().isEmpty() ? null : v.trim();
    }

    public String getLlmBaseUrl() {
        return getProperty(KEY_LLM_BASE_URL, DEFAULT_LLM_BASE_URL);
    }

    public String getLlmModel() {
        return getProperty(KEY_LLM_MODEL, DEFAULT_LLM_MODEL);
    }

    public int getLlmHttpTimeoutSeconds() {
        return getInt(KEY_LLM_HTTP_TIMEOUT_SECONDS, DEFAULT_LLM_HTTP_TIMEOUT_SECONDS);
    }

    public int getLlmHttpRetryMaxAttempts() {
        return getInt(KEY_LLM_HTTP_RETRY_MAX_ATTEMPTS, DEFAULT_LLM_HTTP_RETRY_MAX_ATTEMPTS);
    }

    public long getLlmHttpRetryBackoffMs() {
        return getLong(KEY_LLM_HTTP_RETRY_BACKOFF_MS, DEFAULT_LLM_HTTP_RETRY_BACKOFF_MS);
    }

    public boolean isBrowserHeadless() {
        String v = getProperty(KEY_BROWSER_HEADLESS);
        if (v == null || v.isEmpty()) {
            return DEFAULT_BROWSER_HEADLESS;
        }
        return !("false".equalsIgnoreCase(v) || "0".equals(v) || "no".equalsIgnoreCase(v));
    }

    public int getBrowserNavigationTimeoutMs() {
        return getInt(KEY_BROWSER_NAVIGATION_TIMEOUT_MS, DEFAULT_BROWSER_NAVIGATION_TIMEOUT_MS);
    }

    public int getScrapeHtmlMaxChars() {
        return getInt(KEY_SCRAPE_HTML_MAX_CHARS, DEFAULT_SCRAPE_HTML_MAX_CHARS);
    }

    public int getScrapePaginationHtmlMaxChars() {
        return getInt(KEY_SCRAPE_PAGINATION_HTML_MAX_CHARS, DEFAULT_SCRAPE_PAGINATION_HTML_MAX_CHARS);
    }

    public long getScrapePaginationSettleMs() {
        return getLong(KEY_SCRAPE_PAGINATION_SETTLE_MS, DEFAULT_SCRAPE_PAGINATION_SETTLE_MS);
    }

    private int getInt(String key, int defaultValue) {
        String v = getProperty(key);
        if (v != null && !v.isEmpty()) {
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                AppLog.warn("[config] invalid integer for " + key + "=" + v + ", using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLong(String key, long defaultValue) {
        String v = getProperty(key);
        if (v != null && !v.isEmpty()) {
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                AppLog.warn("[config] invalid number for " + key + "=" + v + ", using default: " + defaultValue);
            }
        }
        return defaultValue;
    }
}
