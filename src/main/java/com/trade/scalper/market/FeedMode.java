package com.trade.scalper.market;

import java.time.Duration;

/**
 * 行情订阅模式及其默认时间参数
 */
public enum FeedMode {
    TICKER(Duration.ofSeconds(8), Duration.ofSeconds(1)),
    KLINE(Duration.ofSeconds(70), Duration.ofSeconds(30));

    private final Duration defaultStaleness;
    private final Duration defaultPollInterval;

    FeedMode(Duration defaultStaleness, Duration defaultPollInterval) {
        this.defaultStaleness = defaultStaleness;
        this.defaultPollInterval = defaultPollInterval;
    }

    public Duration getDefaultStaleness() {
        return defaultStaleness;
    }

    public Duration getDefaultPollInterval() {
        return defaultPollInterval;
    }
}
