package com.qiyi.webagent.llm;

import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * 编排器依赖的补全能力。实现只保证契约，不保证内容正确。
 */
public interface CompletionService {

    String NO_PAGINATION = "NO_PAGINATION";

    /**
     * 按 schema 从页面 HTML 中抽取条目。模型输出无法解析时返回空列表；服务不可用时抛 {@link LlmException}。
     */
    List<Object> extractItems(String html, JSONObject schema);

    /**
     * 猜测“下一页”按钮的 CSS 选择器；没有可用的下一页时返回 {@link #NO_PAGINATION} 或空串。
     */
    String findNextPageSelector(String html);
}
