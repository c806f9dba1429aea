package com.trade.scalper.core;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 现货交易对，如 BTCUSDT
 */
public class Symbol {

    private static final List<String> KNOWN_QUOTES = List.of("USDT", "USDC", "BTC", "ETH", "EUR");

    private final String base;      // 基础货币，如 BTC
    private final String quote;     // 报价货币，如 USDT

    public Symbol(String base, String quote) {
        if (base == null || base.isBlank() || quote == null || quote.isBlank()) {
            throw new IllegalArgumentException("交易对币种不能为空");
        }
        this.base = base.toUpperCase(Locale.ROOT);
        this.quote = quote.toUpperCase(Locale.ROOT);
    }

    /**
     * 解析 BTCUSDT / BTC-USDT / BTC_USDT
     */
    public static Symbol of(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("交易对不能为空");
        }
        String[] parts = symbol.trim().split("[-_/]");
        if (parts.length == 2) {
            return new Symbol(parts[0], parts[1]);
        }
        String upper = symbol.trim().toUpperCase(Locale.ROOT);
        for (String quote : KNOWN_QUOTES) {
            if (upper.endsWith(quote) && upper.length() > quote.length()) {
                return new Symbol(upper.substring(0, upper.length() - quote.length()), quote);
            }
        }
        throw new IllegalArgumentException("无效的交易对格式: " + symbol);
    }

    public String getBase() {
        return base;
    }

    public String getQuote() {
        return quote;
    }

    public String toPairString() {
        return base + quote;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return Objects.equals(base, symbol.base) && Objects.equals(quote, symbol.quote);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, quote);
    }

    @Override
    public String toString() {
        return base + quote;
    }
}
