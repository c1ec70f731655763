package com.qiyi.webagent.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppConfigTest {

    @AfterEach
    public void clearOverrides() {
        System.clearProperty(AppConfig.KEY_LLM_MODEL);
    }

    @Test
    public void emptyPropertiesShouldFallBackToDefaults() {
        AppConfig cfg = new AppConfig(new Properties());

        assertEquals(AppConfig.DEFAULT_LLM_BASE_URL, cfg.getLlmBaseUrl());
        assertEquals(AppConfig.DEFAULT_LLM_MODEL, cfg.getLlmModel());
        assertEquals(3, cfg.getLlmHttpRetryMaxAttempts());
        assertTrue(cfg.isBrowserHeadless());
        assertEquals(30_000, cfg.getBrowserNavigationTimeoutMs());
        assertEquals(50_000, cfg.getScrapeHtmlMaxChars());
        assertEquals(30_000, cfg.getScrapePaginationHtmlMaxChars());
        assertEquals(2_000L, cfg.getScrapePaginationSettleMs());
    }

    @Test
    public void fileValuesShouldOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(AppConfig.KEY_BROWSER_HEADLESS, "false");
        props.setProperty(AppConfig.KEY_SCRAPE_HTML_MAX_CHARS, " 1200 ");
        props.setProperty(AppConfig.KEY_LLM_HTTP_RETRY_BACKOFF_MS, "not-a-number");

        AppConfig cfg = new AppConfig(props);

        assertFalse(cfg.isBrowserHeadless());
        assertEquals(1200, cfg.getScrapeHtmlMaxChars());
        assertEquals(AppConfig.DEFAULT_LLM_HTTP_RETRY_BACKOFF_MS, cfg.getLlmHttpRetryBackoffMs());
    }

    @Test
    public void systemPropertyShouldWin() {
        Properties props = new Properties();
        props.setProperty(AppConfig.KEY_LLM_MODEL, "from-file");
        System.setProperty(AppConfig.KEY_LLM_MODEL, "from-sysprop");

        assertEquals("from-sysprop", new AppConfig(props).getLlmModel());
    }
}
