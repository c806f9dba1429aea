package com.trade.scalper.strategy;

/**
 * 开仓判定
 */
public record EntryDecision(boolean enter, EntryReason reason) {

    public static EntryDecision accept() {
        return new EntryDecision(true, EntryReason.OK);
    }

    public static EntryDecision reject(EntryReason reason) {
        return new EntryDecision(false, reason);
    }

    /**
     * 部分条件满足，需要记录原因
     */
    public boolean isPartialMatch() {
        return !enter && (reason == EntryReason.LATERAL
                || reason == EntryReason.RSI_OVERBOUGHT
                || reason == EntryReason.LOW_VOLUME);
    }
}
