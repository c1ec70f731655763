package com.qiyi.webagent.scrape;

/**
 * 抓取前的预置交互类型。
 */
public enum InteractionType {
    CLICK("click"),
    FILL("fill"),
    WAIT("wait"),
    SCROLL("scroll");

    private final String wireName;

    InteractionType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * 按配置文件中的 type 字段解析；未知值返回 null。
     */
    public static InteractionType fromWireName(String raw) {
        if (raw == null) return null;
        for (InteractionType t : values()) {
            if (t.wireName.equals(raw.trim())) {
                return t;
            }
        }
        return null;
    }
}
