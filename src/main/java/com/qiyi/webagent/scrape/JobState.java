package com.qiyi.webagent.scrape;

/**
 * 抓取任务状态。ERROR 为吸收态。
 */
public enum JobState {
    START,
    NAVIGATED,
    INTERACTED,
    EXTRACTING,
    STRUCTURED,
    SCORED,
    DONE,
    ERROR
}
