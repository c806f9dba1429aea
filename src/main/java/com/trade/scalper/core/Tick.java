package com.trade.scalper.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 最新成交价推送
 */
public class Tick {
    private final Symbol symbol;
    private final BigDecimal price;
    private final Instant observedAt;

    public Tick(Symbol symbol, BigDecimal price, Instant observedAt) {
        this.symbol = symbol;
        this.price = price;
        this.observedAt = observedAt;
    }

    public Symbol getSymbol() { return symbol; }
    public BigDecimal getPrice() { return price; }
    public Instant getObservedAt() { return observedAt; }

    @Override
    public String toString() {
        return "Tick{" + symbol + " " + price.toPlainString() + " @" + observedAt + "}";
    }
}
