package com.trade.scalper.core;

/**
 * 市价单数量单位
 */
public enum MarketUnit {
    BASE("baseCoin"),    // 数量为基础货币
    QUOTE("quoteCoin");  // 数量为报价货币金额

    private final String exchangeCode;

    MarketUnit(String exchangeCode) {
        this.exchangeCode = exchangeCode;
    }

    public String getExchangeCode() {
        return exchangeCode;
    }
}
