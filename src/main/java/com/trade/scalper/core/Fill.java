package com.trade.scalper.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * 一个订单的累计成交：数量求和，价格按成交量加权
 */
public class Fill {
    private final String orderId;
    private final BigDecimal quantity;
    private final BigDecimal averagePrice;
    private final BigDecimal fee;
    private final Instant lastExecTime;

    public Fill(String orderId, BigDecimal quantity, BigDecimal averagePrice, BigDecimal fee, Instant lastExecTime) {
        this.orderId = orderId;
        this.quantity = quantity;
        this.averagePrice = averagePrice;
        this.fee = fee;
        this.lastExecTime = lastExecTime;
    }

    public static Fill empty(String orderId) {
        return new Fill(orderId, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null);
    }

    /**
     * 汇总属于同一订单的成交记录
     */
    public static Fill aggregate(String orderId, List<Execution> executions) {
        BigDecimal qty = BigDecimal.ZERO;
        BigDecimal notional = BigDecimal.ZERO;
        BigDecimal fee = BigDecimal.ZERO;
        Instant last = null;
        for (Execution execution : executions) {
            if (orderId != null && !orderId.equals(execution.orderId())) {
                continue;
            }
            qty = qty.add(execution.quantity());
            notional = notional.add(execution.price().multiply(execution.quantity()));
            if (execution.fee() != null) {
                fee = fee.add(execution.fee());
            }
            if (execution.execTime() != null && (last == null || execution.execTime().isAfter(last))) {
                last = execution.execTime();
            }
        }
        if (qty.signum() == 0) {
            return empty(orderId);
        }
        BigDecimal avg = notional.divide(qty, 8, RoundingMode.HALF_UP).stripTrailingZeros();
        return new Fill(orderId, qty, avg, fee, last);
    }

    public String getOrderId() { return orderId; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getAveragePrice() { return averagePrice; }
    public BigDecimal getFee() { return fee; }
    public Instant getLastExecTime() { return lastExecTime; }

    public boolean isFilled() {
        return quantity.signum() > 0 && averagePrice.signum() > 0;
    }

    @Override
    public String toString() {
        return String.format("Fill{orderId=%s, qty=%s, avgPrice=%s, fee=%s}",
                orderId, quantity.toPlainString(), averagePrice.toPlainString(), fee.toPlainString());
    }
}
