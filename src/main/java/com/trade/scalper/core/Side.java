package com.trade.scalper.core;

/**
 * 订单方向
 */
public enum Side {
    BUY("Buy"),
    SELL("Sell");

    private final String exchangeCode;

    Side(String exchangeCode) {
        this.exchangeCode = exchangeCode;
    }

    public String getExchangeCode() {
        return exchangeCode;
    }

    public static Side fromExchangeCode(String code) {
        for (Side value : values()) {
            if (value.exchangeCode.equalsIgnoreCase(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("未知订单方向: " + code);
    }
}
