package com.trade.scalper.core;

import java.time.Duration;

/**
 * K线周期
 */
public enum Interval {
    ONE_MINUTE("1m", 1, "1"),
    THREE_MINUTES("3m", 3, "3"),
    FIVE_MINUTES("5m", 5, "5"),
    FIFTEEN_MINUTES("15m", 15, "15"),
    ONE_HOUR("1h", 60, "60");

    private final String code;
    private final int minutes;
    private final String exchangeCode;   // Bybit interval 参数

    Interval(String code, int minutes, String exchangeCode) {
        this.code = code;
        this.minutes = minutes;
        this.exchangeCode = exchangeCode;
    }

    public String getCode() {
        return code;
    }

    public String getExchangeCode() {
        return exchangeCode;
    }

    public Duration getDuration() {
        return Duration.ofMinutes(minutes);
    }

    public static Interval fromCode(String code) {
        for (Interval interval : values()) {
            if (interval.code.equals(code) || interval.exchangeCode.equals(code)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("不支持的K线周期: " + code);
    }
}
