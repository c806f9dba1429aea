package com.trade.scalper.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * K线数据
 * 只有已确认（收盘）的K线才参与决策
 */
public class KLine {
    private final Symbol symbol;
    private final Interval interval;         // 周期
    private final Instant openTime;          // 开盘时间
    private final Instant closeTime;         // 收盘时间
    private final BigDecimal open;           // 开盘价
    private final BigDecimal high;           // 最高价
    private final BigDecimal low;            // 最低价
    private final BigDecimal close;          // 收盘价
    private final BigDecimal volume;         // 成交量
    private final BigDecimal turnover;       // 成交额
    private final boolean confirmed;         // 是否已收盘

    public KLine(Symbol symbol, Interval interval, Instant openTime, Instant closeTime,
                 BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                 BigDecimal volume, BigDecimal turnover, boolean confirmed) {
        this.symbol = symbol;
        this.interval = interval;
        this.openTime = openTime;
        this.closeTime = closeTime;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
        this.turnover = turnover;
        this.confirmed = confirmed;
    }

    public Symbol getSymbol() { return symbol; }
    public Interval getInterval() { return interval; }
    public Instant getOpenTime() { return openTime; }
    public Instant getCloseTime() { return closeTime; }
    public BigDecimal getOpen() { return open; }
    public BigDecimal getHigh() { return high; }
    public BigDecimal getLow() { return low; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getVolume() { return volume; }
    public BigDecimal getTurnover() { return turnover; }
    public boolean isConfirmed() { return confirmed; }

    /**
     * 以确认状态复制一根K线
     */
    public KLine withConfirmed(boolean confirmed) {
        if (this.confirmed == confirmed) {
            return this;
        }
        return new KLine(symbol, interval, openTime, closeTime, open, high, low, close,
                volume, turnover, confirmed);
    }

    @Override
    public String toString() {
        return String.format("KLine{symbol=%s, interval=%s, time=%s, OHLC=[%s,%s,%s,%s], vol=%s, confirmed=%s}",
                symbol, interval.getCode(), openTime, open, high, low, close, volume, confirmed);
    }
}
