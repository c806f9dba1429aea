package com.trade.scalper.core;

/**
 * 现货订单类别
 */
public enum OrderFilter {
    ORDER("Order"),
    TPSL_ORDER("tpslOrder");   // 条件单（止盈止损触发）

    private final String exchangeCode;

    OrderFilter(String exchangeCode) {
        this.exchangeCode = exchangeCode;
    }

    public String getExchangeCode() {
        return exchangeCode;
    }
}
