package com.trade.scalper.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 持仓
 * 仅由交易引擎在确认成交后创建，平仓后丢弃
 */
public class Position {
    private final Symbol symbol;
    private final BigDecimal entryPrice;      // 开仓均价
    private final BigDecimal quantity;        // 持仓数量（基础货币）
    private final Instant openedAt;           // 开仓时间
    private final BigDecimal stopLossPrice;   // 止损价格

    public Position(Symbol symbol, BigDecimal entryPrice, BigDecimal quantity,
                    Instant openedAt, BigDecimal stopLossPrice) {
        this.symbol = symbol;
        this.entryPrice = entryPrice;
        this.quantity = quantity;
        this.openedAt = openedAt;
        this.stopLossPrice = stopLossPrice;
    }

    public Symbol getSymbol() { return symbol; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getQuantity() { return quantity; }
    public Instant getOpenedAt() { return openedAt; }
    public BigDecimal getStopLossPrice() { return stopLossPrice; }

    /**
     * 投入金额 = 开仓价 × 平仓数量
     */
    public BigDecimal investmentFor(BigDecimal closedQuantity) {
        return entryPrice.multiply(closedQuantity);
    }

    /**
     * 按实际平仓数量计算盈亏，手续费以基础货币扣除时小于持仓数量
     */
    public BigDecimal pnlAt(BigDecimal exitPrice, BigDecimal closedQuantity) {
        return exitPrice.subtract(entryPrice).multiply(closedQuantity);
    }

    @Override
    public String toString() {
        return String.format("Position{symbol=%s, entry=%s, qty=%s, stopLoss=%s, openedAt=%s}",
                symbol, entryPrice.toPlainString(), quantity.toPlainString(),
                stopLossPrice.toPlainString(), openedAt);
    }
}
