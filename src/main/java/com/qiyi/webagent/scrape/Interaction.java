package com.qiyi.webagent.scrape;

/**
 * 一条预置交互。字段是否有意义取决于 {@link #getType()}：
 * click 用 selector，fill 用 selector + value，wait 用 durationMs，scroll 用 direction。
 */
public final class Interaction {
    public static final long DEFAULT_WAIT_MS = 1000L;
    public static final String DEFAULT_SCROLL_DIRECTION = "bottom";

    private final InteractionType type;
    private final String selector;
    private final String value;
    private final long durationMs;
    private final String direction;

    private Interaction(InteractionType type, String selector, String value, long durationMs, String direction) {
        this.type = type;
        this.selector = selector;
        this.value = value;
        this.durationMs = durationMs;
        this.direction = direction;
    }

    public static Interaction click(String selector) {
        return new Interaction(InteractionType.CLICK, selector, null, 0L, null);
    }

    public static Interaction fill(String selector, String value) {
        return new Interaction(InteractionType.FILL, selector, value, 0L, null);
    }

    public static Interaction waitFor(long durationMs) {
        return new Interaction(InteractionType.WAIT, null, null, durationMs, null);
    }

    public static Interaction scroll(String direction) {
        return new Interaction(InteractionType.SCROLL, null, null, 0L,
                direction == null || direction.isEmpty() ? DEFAULT_SCROLL_DIRECTION : direction);
    }

    public InteractionType getType() {
        return type;
    }

    public String getSelector() {
        return selector;
    }

    public String getValue() {
        return value;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        switch (type) {
            case CLICK:
                return "click(" + selector + ")";
            case FILL:
                return "fill(" + selector + ")";
            case WAIT:
                return "wait(" + durationMs + "ms)";
            case SCROLL:
                return "scroll(" + direction + ")";
            default:
                return type.getWireName();
        }
    }
}
