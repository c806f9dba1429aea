package com.trade.scalper.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 实时行情快照（REST）
 */
public class Ticker {
    private final Symbol symbol;
    private final BigDecimal bidPrice;       // 最优买一价
    private final BigDecimal askPrice;       // 最优卖一价
    private final BigDecimal lastPrice;      // 最新成交价
    private final Instant timestamp;         // 时间戳

    public Ticker(Symbol symbol, BigDecimal bidPrice, BigDecimal askPrice,
                  BigDecimal lastPrice, Instant timestamp) {
        this.symbol = symbol;
        this.lastPrice = lastPrice;
        this.bidPrice = bidPrice != null ? bidPrice : lastPrice;
        this.askPrice = askPrice != null ? askPrice : lastPrice;
        this.timestamp = timestamp;
    }

    public Symbol getSymbol() { return symbol; }
    public BigDecimal getBidPrice() { return bidPrice; }
    public BigDecimal getAskPrice() { return askPrice; }
    public BigDecimal getLastPrice() { return lastPrice; }
    public Instant getTimestamp() { return timestamp; }

    public Tick toTick() {
        return new Tick(symbol, lastPrice, timestamp);
    }
}
