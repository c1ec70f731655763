package com.qiyi.webagent.scrape;

/**
 * 任务配置文件缺失、不是合法 JSON 或字段不合法。
 */
public class ScrapeConfigException extends Exception {

    public ScrapeConfigException(String message) {
        super(message);
    }

    public ScrapeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
