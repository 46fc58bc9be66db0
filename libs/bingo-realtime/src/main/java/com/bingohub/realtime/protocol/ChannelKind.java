package com.bingohub.realtime.protocol;

/**
 * 频道类别：叫号/局面事件与声明事件分频道发布，便于按需订阅与隔离。
 */
public enum ChannelKind {
    CALLS("calls"),
    CLAIMS("claims");

    private final String suffix;

    ChannelKind(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }
}
