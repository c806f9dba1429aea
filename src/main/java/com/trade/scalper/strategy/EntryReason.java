package com.trade.scalper.strategy;

/**
 * 开仓判定结果代码
 */
public enum EntryReason {
    OK("ok"),
    NO_SIGNAL(""),                      // EMA 未形成多头排列
    INSUFFICIENT_DATA("no_data"),       // 指标不完整
    LATERAL("lateral"),                 // ADX 不足，横盘
    RSI_OVERBOUGHT("rsi_overbought"),   // RSI 超买
    LOW_VOLUME("low_volume");           // 成交量不足

    private final String code;

    EntryReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
