package com.trade.scalper.core;

import java.util.Locale;

/**
 * Bybit 运行环境
 */
public enum TradingEnvironment {
    DEMO("https://api-demo.bybit.com", "wss://stream.bybit.com/v5/public/spot"),
    TESTNET("https://api-testnet.bybit.com", "wss://stream-testnet.bybit.com/v5/public/spot"),
    PROD("https://api.bybit.com", "wss://stream.bybit.com/v5/public/spot");

    private final String restBaseUrl;
    private final String publicStreamUrl;

    TradingEnvironment(String restBaseUrl, String publicStreamUrl) {
        this.restBaseUrl = restBaseUrl;
        this.publicStreamUrl = publicStreamUrl;
    }

    public String getRestBaseUrl() {
        return restBaseUrl;
    }

    public String getPublicStreamUrl() {
        return publicStreamUrl;
    }

    /**
     * 模拟盘账户不推送 WebSocket 行情，且不接受 marketUnit 参数
     */
    public boolean isDemo() {
        return this == DEMO;
    }

    public static TradingEnvironment fromCode(String code) {
        if (code == null || code.isBlank()) {
            return DEMO;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if ("MAINNET".equals(normalized) || "LIVE".equals(normalized)) {
            return PROD;
        }
        return TradingEnvironment.valueOf(normalized);
    }
}
