package com.trade.scalper.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 账户类型
 */
public enum AccountType {
    UNIFIED,
    SPOT,
    CONTRACT;

    public static AccountType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNIFIED;
        }
        return AccountType.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * 探测顺序：配置的类型优先，其余按声明顺序
     */
    public static List<AccountType> probeOrder(AccountType preferred) {
        List<AccountType> order = new ArrayList<>();
        order.add(preferred);
        for (AccountType type : values()) {
            if (type != preferred) {
                order.add(type);
            }
        }
        return order;
    }
}
