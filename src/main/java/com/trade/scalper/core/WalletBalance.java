package com.trade.scalper.core;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 钱包可用余额快照，不缓存，每次使用前重新查询
 */
public class WalletBalance {
    private final AccountType accountType;
    private final Map<String, BigDecimal> available;

    public WalletBalance(AccountType accountType, Map<String, BigDecimal> available) {
        this.accountType = accountType;
        Map<String, BigDecimal> copy = new LinkedHashMap<>();
        available.forEach((asset, amount) -> copy.put(asset.toUpperCase(Locale.ROOT), amount));
        this.available = Collections.unmodifiableMap(copy);
    }

    public AccountType getAccountType() {
        return accountType;
    }

    /**
     * 指定币种可用余额，缺失时为 0
     */
    public BigDecimal getAvailable(String asset) {
        return available.getOrDefault(asset.toUpperCase(Locale.ROOT), BigDecimal.ZERO);
    }

    @Override
    public String toString() {
        return "WalletBalance{" + accountType + ", " + available + "}";
    }
}
