package com.trade.scalper.strategy;

/**
 * 平仓原因，按检查顺序排列
 */
public enum ExitReason {
    TAKE_PROFIT("tp"),
    STOP_LOSS("sl"),
    TIMEOUT("timeout");

    private final String code;

    ExitReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
