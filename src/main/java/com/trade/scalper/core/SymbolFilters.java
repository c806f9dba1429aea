package com.trade.scalper.core;

import java.math.BigDecimal;

/**
 * 交易对下单规则
 * 数量步长、最小数量、价格步长与最小下单金额，全部由交易所返回
 */
public class SymbolFilters {
    private final Symbol symbol;
    private final BigDecimal qtyStep;          // 数量步长
    private final BigDecimal minQty;           // 最小数量
    private final BigDecimal maxQty;           // 最大数量（可空）
    private final BigDecimal basePrecision;    // 基础货币精度步长
    private final BigDecimal quotePrecision;   // 报价货币精度步长
    private final BigDecimal priceTick;        // 价格步长
    private final BigDecimal minPrice;         // 最小价格（可空）
    private final BigDecimal maxPrice;         // 最大价格（可空）
    private final BigDecimal minNotional;      // 最小下单金额

    public SymbolFilters(Symbol symbol, BigDecimal qtyStep, BigDecimal minQty, BigDecimal maxQty,
                         BigDecimal basePrecision, BigDecimal quotePrecision,
                         BigDecimal priceTick, BigDecimal minPrice, BigDecimal maxPrice,
                         BigDecimal minNotional) {
        if (!Decimal.isPositive(qtyStep)) {
            throw new IllegalArgumentException("数量步长必须大于0: " + qtyStep);
        }
        if (!Decimal.isPositive(priceTick)) {
            throw new IllegalArgumentException("价格步长必须大于0: " + priceTick);
        }
        this.symbol = symbol;
        this.qtyStep = qtyStep;
        this.minQty = minQty != null ? minQty : BigDecimal.ZERO;
        this.maxQty = maxQty;
        this.basePrecision = basePrecision != null ? basePrecision : qtyStep;
        this.quotePrecision = quotePrecision != null ? quotePrecision : Decimal.stepOfDecimals(2);
        this.priceTick = priceTick;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.minNotional = minNotional != null ? minNotional : BigDecimal.ZERO;
    }

    public Symbol getSymbol() { return symbol; }
    public BigDecimal getQtyStep() { return qtyStep; }
    public BigDecimal getMinQty() { return minQty; }
    public BigDecimal getMaxQty() { return maxQty; }
    public BigDecimal getBasePrecision() { return basePrecision; }
    public BigDecimal getQuotePrecision() { return quotePrecision; }
    public BigDecimal getPriceTick() { return priceTick; }
    public BigDecimal getMinPrice() { return minPrice; }
    public BigDecimal getMaxPrice() { return maxPrice; }
    public BigDecimal getMinNotional() { return minNotional; }

    @Override
    public String toString() {
        return String.format("SymbolFilters{%s, qtyStep=%s, minQty=%s, tick=%s, minNotional=%s}",
                symbol, qtyStep.toPlainString(), minQty.toPlainString(),
                priceTick.toPlainString(), minNotional.toPlainString());
    }
}
