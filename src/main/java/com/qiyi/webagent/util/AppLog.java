package com.qiyi.webagent.util;

import ch.qos.logback.classic.Level;
import com.alibaba.fastjson2.JSON;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class AppLog {
    private static final Logger LOG = LoggerFactory.getLogger("webAgents");

    private AppLog() {
    }

    public static void debug(Object msg) {
        LOG.debug("{}", msg);
    }

    public static void info(Object msg) {
        LOG.info("{}", msg);
    }

    public static void warn(Object msg) {
        LOG.warn("{}", msg);
    }

    public static void error(Object msg) {
        if (msg instanceof Throwable) {
            Throwable t = (Throwable) msg;
            LOG.error("{}", t.getMessage(), t);
            return;
        }
        LOG.error("{}", msg);
    }

    public static void error(String msg, Throwable t) {
        LOG.error(msg, t);
    }

    /**
     * 结构化事件：输出为 {@code <event> {"k":v,...}}，字段按插入顺序，null 值省略。
     */
    public static void event(String event, Map<String, Object> fields) {
        LOG.info("{} {}", event, fields == null ? "{}" : JSON.toJSONString(fields));
    }

    /**
     * 运行期切换根日志级别（CLI --verbose 使用）。仅在绑定 logback 时生效。
     */
    public static void setVerbose(boolean verbose) {
        Level level = verbose ? Level.DEBUG : Level.INFO;
        for (Logger logger : new Logger[]{LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME), LOG}) {
            if (logger instanceof ch.qos.logback.classic.Logger) {
                ((ch.qos.logback.classic.Logger) logger).setLevel(level);
            }
        }
    }
}
