package com.qiyi.webagent.llm;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.qiyi.webagent.config.AppConfig;
import com.qiyi.webagent.util.AppLog;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 兼容的 chat/completions 客户端。
 *
 * <p>对 408/409/425/429/5xx 与 IO 异常按线性退避重试；其余 HTTP 错误直接返回失败结果。</p>
 */
public class LlmClient {
    private static final int CONNECT_TIMEOUT_SECONDS = 20;

    private final HttpClient httpClient;
    private final String url;
    private final String apiKey;
    private final String model;
    private final int requestTimeoutSeconds;
    private final int maxAttempts;
    private final long backoffMillis;

    public LlmClient(String url, String apiKey, String model, int requestTimeoutSeconds, int maxAttempts, long backoffMillis) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                .build();
        this.url = url;
        this.apiKey = apiKey;
        this.model = model;
        this.requestTimeoutSeconds = requestTimeoutSeconds;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = Math.max(0L, backoffMillis);
    }

    public static LlmClient fromConfig(AppConfig cfg, String apiKey) {
        return new LlmClient(cfg.getLlmBaseUrl(), apiKey, cfg.getLlmModel(),
                cfg.getLlmHttpTimeoutSeconds(), cfg.getLlmHttpRetryMaxAttempts(), cfg.getLlmHttpRetryBackoffMs());
    }

    private static boolean hasKey(String key) {
        return key != null && !key.trim().isEmpty();
    }

    /**
     * 单轮对话，temperature 固定为 0。失败时返回 {@link LLMResult#fail}，不抛出。
     */
    public LLMResult chat(String prompt, int maxTokens) {
        if (!hasKey(apiKey)) {
            return LLMResult.fail(model, "LLM API Key is missing!");
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        Map<String, Object> message = new HashMap<>();
        message.put("role", "user");
        message.put("content", prompt);
        payload.put("messages", List.of(message));
        payload.put("temperature", 0);
        payload.put("max_tokens", maxTokens);
        payload.put("stream", false);
        try {
            return postChatCompletion(payload);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LLMResult.fail(model, "Interrupted");
        } catch (Exception e) {
            AppLog.error("[llm] chat error: " + e.getMessage(), e);
            return LLMResult.fail(model, e.getMessage());
        }
    }

    private LLMResult postChatCompletion(Map<String, Object> payload) throws IOException, InterruptedException {
        String jsonBody = JSON.toJSONString(payload);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(requestTimeoutSeconds))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();

            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int code = response.statusCode();
                if (code >= 200 && code < 300) {
                    return parseCompletion(response.body());
                }

                boolean retryable = code == 408 || code == 409 || code == 425 || code == 429 || (code >= 500 && code <= 599);
                if (!retryable || attempt == maxAttempts) {
                    String err = "HTTP " + code + " - " + response.body();
                    AppLog.warn("[llm] http error: " + err);
                    return LLMResult.fail(model, err);
                }
                AppLog.info("[llm] retryable status=" + code + ", attempt=" + attempt + "/" + maxAttempts);
            } catch (IOException e) {
                if (attempt == maxAttempts) throw e;
                AppLog.info("[llm] io error, attempt=" + attempt + "/" + maxAttempts + ", err=" + e.getMessage());
            }

            Thread.sleep(backoffMillis * attempt);
        }
        return LLMResult.fail(model, "Unknown error");
    }

    private LLMResult parseCompletion(String body) {
        JSONObject json = JSON.parseObject(body);
        if (json == null) {
            return LLMResult.fail(model, "Empty completion response");
        }
        JSONArray choices = json.getJSONArray("choices");
        String content = "";
        if (choices != null && !choices.isEmpty()) {
            JSONObject first = choices.getJSONObject(0);
            JSONObject msg = first == null ? null : first.getJSONObject("message");
            if (msg != null) {
                String c = msg.getString("content");
                content = c == null ? "" : c;
            }
        }

        Map<String, Object> usage = null;
        JSONObject usageObj = json.getJSONObject("usage");
        if (usageObj != null) {
            usage = new HashMap<>(usageObj);
        }
        return LLMResult.ok(content, model, usage);
    }
}
