package com.qiyi.webagent.agent;

import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.browser.PlaywrightSessionManager;
import com.qiyi.webagent.config.AppConfig;
import com.qiyi.webagent.server.RequestDispatcher;
import com.qiyi.webagent.tools.ToolExecutionService;
import com.qiyi.webagent.tools.ToolRegistry;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * stdio 协议服务入口：stdin 读请求，stdout 写响应，日志只走 stderr。
 *
 * <p>start() 阻塞到输入结束；stop() 关闭全部浏览器会话。</p>
 */
public class McpServerAgent extends AbstractAgent {
    private final BrowserSessionManager sessionManager;
    private final RequestDispatcher dispatcher;
    private final InputStream in;
    private final OutputStream out;

    public McpServerAgent(BrowserSessionManager sessionManager, AppConfig cfg, InputStream in, OutputStream out) {
        this.sessionManager = sessionManager;
        this.dispatcher = new RequestDispatcher(new ToolExecutionService(ToolRegistry.defaults(sessionManager, cfg)));
        this.in = in;
        this.out = out;
    }

    @Override
    protected void doStart() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        try {
            dispatcher.serve(reader, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("stdio channel failed", e);
        }
    }

    @Override
    protected void doStop() {
        sessionManager.shutdown();
    }

    public static void main(String[] args) {
        AppConfig cfg = AppConfig.getInstance();
        McpServerAgent agent = new McpServerAgent(PlaywrightSessionManager.fromConfig(cfg), cfg, System.in, System.out);
        Runtime.getRuntime().addShutdownHook(new Thread(agent::stop));
        try {
            agent.start();
        } finally {
            agent.stop();
        }
    }
}
