package com.trade.scalper.execution;

/**
 * 交易日志
 */
public interface TradeJournal {

    /**
     * 记录一笔交易，实现不得向调用方抛出异常
     */
    void record(TradeRecord record);
}
