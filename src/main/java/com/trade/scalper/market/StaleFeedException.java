package com.trade.scalper.market;

import com.trade.scalper.core.Symbol;

import java.time.Duration;

/**
 * 推送通道在阈值时间内没有任何事件
 */
public class StaleFeedException extends Exception {

    private final Duration silence;

    public StaleFeedException(Symbol symbol, Duration silence, Duration threshold) {
        super(String.format("%s 推送行情已 %dms 无事件（阈值 %dms）",
                symbol, silence.toMillis(), threshold.toMillis()));
        this.silence = silence;
    }

    public Duration getSilence() {
        return silence;
    }
}
