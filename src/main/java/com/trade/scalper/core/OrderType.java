package com.trade.scalper.core;

/**
 * 订单类型
 */
public enum OrderType {
    MARKET("Market"),  // 市价单，立即成交
    LIMIT("Limit");    // 限价单，指定价格

    private final String exchangeCode;

    OrderType(String exchangeCode) {
        this.exchangeCode = exchangeCode;
    }

    public String getExchangeCode() {
        return exchangeCode;
    }

    public static OrderType fromExchangeCode(String code) {
        for (OrderType value : values()) {
            if (value.exchangeCode.equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("未知订单类型: " + code);
    }
}
