package com.qiyi.webagent.agent;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.qiyi.webagent.browser.PlaywrightSessionManager;
import com.qiyi.webagent.config.AppConfig;
import com.qiyi.webagent.tools.Tool;
import com.qiyi.webagent.tools.ToolCallResult;
import com.qiyi.webagent.tools.ToolExecutionService;
import com.qiyi.webagent.tools.ToolRegistry;
import com.qiyi.webagent.util.AppLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * 工具导览：打开 example.com，截图，提取链接并跟随第一个外链，再截图。
 *
 * <pre>
 * ToolTourAgent [outputDir]
 * </pre>
 */
public class ToolTourAgent {
    public static final String START_URL = "https://example.com/";

    private final ToolExecutionService tools;
    private final Path outputDir;

    public ToolTourAgent(ToolExecutionService tools, Path outputDir) {
        this.tools = tools;
        this.outputDir = outputDir;
    }

    /**
     * @return 保存的截图文件，按生成顺序
     */
    public List<Path> run() throws IOException {
        List<Path> saved = new ArrayList<>();

        ToolCallResult nav = call("navigate", null, urlArgs(START_URL));
        String sessionId = nav.getSessionId();
        AppLog.info("[tour] session " + sessionId + " at " + nav.getData().getString("current_url"));

        ToolCallResult shot = call("screenshot", sessionId, viewportArgs());
        saved.add(savePng(shot, "1_viewport.png"));

        ToolCallResult links = call("extract_links", sessionId, new JSONObject());
        String external = firstExternal(links.getData().getJSONArray("links"));
        if (external == null) {
            throw new IllegalStateException("No external link found on " + START_URL);
        }

        nav = call("navigate", sessionId, urlArgs(external));
        sessionId = nav.getSessionId();
        AppLog.info("[tour] followed external link to " + nav.getData().getString("current_url"));

        shot = call("screenshot", sessionId, viewportArgs());
        saved.add(savePng(shot, "2_external.png"));
        return saved;
    }

    private ToolCallResult call(String name, String sessionId, JSONObject params) {
        if (sessionId != null) {
            params.put(Tool.ARG_SESSION_ID, sessionId);
        }
        ToolCallResult res = tools.call(name, params);
        if (!res.isOk()) {
            throw new ToolTourException(name, res.getError().getCode().name(), res.getError().getMessage());
        }
        return res;
    }

    private Path savePng(ToolCallResult shot, String fileName) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(fileName);
        Files.write(target, Base64.getDecoder().decode(shot.getData().getString("image_b64")));
        AppLog.info("[tour] saved " + target);
        return target;
    }

    static String firstExternal(JSONArray links) {
        if (links == null) return null;
        for (int i = 0; i < links.size(); i++) {
            JSONObject link = links.getJSONObject(i);
            if (link != null && link.getBooleanValue("is_external")) {
                return link.getString("url");
            }
        }
        return null;
    }

    private static JSONObject urlArgs(String url) {
        JSONObject args = new JSONObject();
        args.put("url", url);
        return args;
    }

    private static JSONObject viewportArgs() {
        JSONObject args = new JSONObject();
        args.put("mode", "viewport");
        return args;
    }

    public static void main(String[] args) throws IOException {
        AppConfig cfg = AppConfig.getInstance();
        Path outputDir = Paths.get(args.length > 0 ? args[0] : "demo");
        PlaywrightSessionManager sessionManager = PlaywrightSessionManager.fromConfig(cfg);
        int status = 0;
        try {
            ToolTourAgent tour = new ToolTourAgent(new ToolExecutionService(ToolRegistry.defaults(sessionManager, cfg)), outputDir);
            for (Path p : tour.run()) {
                System.out.println("Saved " + p);
            }
        } catch (ToolTourException e) {
            System.err.println("[tour] " + e.getMessage());
            System.err.println("Aborting tour. Please fix the input or retry with a reachable URL.");
            status = 1;
        } finally {
            sessionManager.shutdown();
        }
        if (status != 0) {
            System.exit(status);
        }
    }
}
