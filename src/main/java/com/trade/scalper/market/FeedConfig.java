package com.trade.scalper.market;

import com.trade.scalper.core.Interval;
import com.trade.scalper.core.Symbol;

import java.time.Duration;

/**
 * 行情源配置
 */
public class FeedConfig {
    private final Symbol symbol;
    private final Interval interval;
    private final FeedMode mode;
    private final Duration stalenessThreshold;   // 超过该时长无事件即切换到轮询
    private final Duration watchdogInterval;
    private final Duration pollInterval;
    private final Duration joinTimeout;
    private final int pollKLineLimit;
    private final Duration candleRefreshInterval; // 最新价模式下补充K线的间隔
    private final boolean startInFallback;        // 模拟盘直接轮询

    private FeedConfig(Builder builder) {
        this.symbol = builder.symbol;
        this.interval = builder.interval;
        this.mode = builder.mode;
        this.stalenessThreshold = builder.stalenessThreshold != null
                ? builder.stalenessThreshold : builder.mode.getDefaultStaleness();
        this.watchdogInterval = builder.watchdogInterval;
        this.pollInterval = builder.pollInterval != null
                ? builder.pollInterval : builder.mode.getDefaultPollInterval();
        this.joinTimeout = builder.joinTimeout;
        this.pollKLineLimit = builder.pollKLineLimit;
        this.candleRefreshInterval = builder.candleRefreshInterval;
        this.startInFallback = builder.startInFallback;
    }

    public Symbol getSymbol() { return symbol; }
    public Interval getInterval() { return interval; }
    public FeedMode getMode() { return mode; }
    public Duration getStalenessThreshold() { return stalenessThreshold; }
    public Duration getWatchdogInterval() { return watchdogInterval; }
    public Duration getPollInterval() { return pollInterval; }
    public Duration getJoinTimeout() { return joinTimeout; }
    public int getPollKLineLimit() { return pollKLineLimit; }
    public Duration getCandleRefreshInterval() { return candleRefreshInterval; }
    public boolean isStartInFallback() { return startInFallback; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Symbol symbol;
        private Interval interval = Interval.ONE_MINUTE;
        private FeedMode mode = FeedMode.KLINE;
        private Duration stalenessThreshold;
        private Duration watchdogInterval = Duration.ofSeconds(2);
        private Duration pollInterval;
        private Duration joinTimeout = Duration.ofSeconds(2);
        private int pollKLineLimit = 3;
        private Duration candleRefreshInterval = Duration.ofSeconds(30);
        private boolean startInFallback;

        public Builder symbol(Symbol symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder interval(Interval interval) {
            this.interval = interval;
            return this;
        }

        public Builder mode(FeedMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder stalenessThreshold(Duration stalenessThreshold) {
            this.stalenessThreshold = stalenessThreshold;
            return this;
        }

        public Builder watchdogInterval(Duration watchdogInterval) {
            this.watchdogInterval = watchdogInterval;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder joinTimeout(Duration joinTimeout) {
            this.joinTimeout = joinTimeout;
            return this;
        }

        public Builder pollKLineLimit(int pollKLineLimit) {
            this.pollKLineLimit = pollKLineLimit;
            return this;
        }

        public Builder candleRefreshInterval(Duration candleRefreshInterval) {
            this.candleRefreshInterval = candleRefreshInterval;
            return this;
        }

        public Builder startInFallback(boolean startInFallback) {
            this.startInFallback = startInFallback;
            return this;
        }

        public FeedConfig build() {
            if (symbol == null || interval == null || mode == null) {
                throw new IllegalStateException("交易对、周期、模式不能为空");
            }
            if (watchdogInterval == null || watchdogInterval.isNegative() || watchdogInterval.isZero()) {
                throw new IllegalStateException("看门狗间隔必须大于0");
            }
            if (candleRefreshInterval == null || candleRefreshInterval.isNegative() || candleRefreshInterval.isZero()) {
                throw new IllegalStateException("K线刷新间隔必须大于0");
            }
            if (pollKLineLimit < 2) {
                throw new IllegalStateException("轮询K线数量至少为2");
            }
            return new FeedConfig(this);
        }
    }
}
