package com.qiyi.webagent.llm;

import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.qiyi.webagent.util.AppLog;

import java.util.List;

/**
 * 基于 {@link LlmClient} 的补全实现：构造抽取与翻页提示词，解析模型输出。
 */
public class LlmCompletionService implements CompletionService {
    static final int EXTRACTION_MAX_TOKENS = 4096;
    static final int PAGINATION_MAX_TOKENS = 256;

    private final LlmClient client;

    public LlmCompletionService(LlmClient client) {
        this.client = client;
    }

    @Override
    public List<Object> extractItems(String html, JSONObject schema) {
        String prompt = buildExtractionPrompt(html, schema);
        String text = complete(prompt, EXTRACTION_MAX_TOKENS, "extraction");
        List<Object> items = LlmResponseParser.parseItems(text);
        AppLog.info("[llm] extraction done, items=" + items.size());
        return items;
    }

    @Override
    public String findNextPageSelector(String html) {
        String text = complete(buildPaginationPrompt(html), PAGINATION_MAX_TOKENS, "pagination");
        return LlmResponseParser.cleanSelector(text);
    }

    private String complete(String prompt, int maxTokens, String purpose) {
        LLMResult res = client.chat(prompt, maxTokens);
        if (res == null || !res.isSuccess()) {
            String err = res == null ? "no result" : res.getError();
            throw new LlmException("Completion request failed (" + purpose + "): " + err);
        }
        AppLog.debug("[llm] " + purpose + " completed: model=" + res.getModel() + ", usage=" + res.getUsage());
        return res.getText();
    }

    static String buildExtractionPrompt(String html, JSONObject schema) {
        String schemaStr = schema == null ? "{}" : schema.toJSONString(JSONWriter.Feature.PrettyFormat);
        return "You are a web scraping expert. Your task is to extract structured data from HTML according to a provided schema.\n"
                + "\n"
                + "TARGET SCHEMA:\n"
                + schemaStr + "\n"
                + "\n"
                + "HTML CONTENT:\n"
                + html + "\n"
                + "\n"
                + "INSTRUCTIONS:\n"
                + "1. Analyze the HTML to identify elements that match each field in the schema\n"
                + "2. Extract ALL items that match the schema structure (if it's a list of products, extract ALL products)\n"
                + "3. For each field, extract the appropriate data:\n"
                + "   - For \"string\" types: extract text content\n"
                + "   - For \"number\" types: extract numeric values (remove currency symbols, convert to float)\n"
                + "   - For \"boolean\" types: determine true/false based on presence/absence or text content\n"
                + "   - For nested objects: extract all nested fields\n"
                + "4. Return ONLY valid JSON matching the schema structure\n"
                + "5. If a field cannot be found, use null for that field\n"
                + "6. Ensure all extracted data is properly formatted and typed\n"
                + "\n"
                + "OUTPUT FORMAT:\n"
                + "Return a JSON object whose \"items\" array holds every extracted item:\n"
                + "{\"items\": [item1, item2, ...]}\n"
                + "\n"
                + "DO NOT include explanations, markdown formatting, or any text outside the JSON.\n"
                + "Start your response with { and end with }.\n";
    }

    static String buildPaginationPrompt(String html) {
        return "Analyze this HTML and identify the CSS selector for the \"next page\" button or link.\n"
                + "\n"
                + "HTML:\n"
                + html + "\n"
                + "\n"
                + "INSTRUCTIONS:\n"
                + "1. Look for common pagination patterns: \"Next\", \"Suivant\", \"→\", page numbers, etc.\n"
                + "2. The button/link MUST be active and clickable (not disabled or grayed out)\n"
                + "3. AVOID disabled elements: classes like \"disabled\", \"inactive\", \"current\"; "
                + "aria-disabled=\"true\" or disabled attributes; links without href or with href=\"#\"\n"
                + "4. Prefer specific selectors that target ONLY the active next button:\n"
                + "   - Good: li.next:not(.disabled) a, a.next-page[href], .pagination-next:not([disabled])\n"
                + "   - Bad: .next, a[rel=\"next\"]\n"
                + "5. Return ONLY the CSS selector, nothing else (no backticks, no markdown)\n"
                + "6. If no ACTIVE pagination button is found (e.g., we're on the last page), return exactly: "
                + NO_PAGINATION + "\n"
                + "\n"
                + "Return only the selector or " + NO_PAGINATION + ":";
    }
}
