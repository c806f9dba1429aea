package com.trade.scalper.execution;

import com.trade.scalper.core.Side;
import com.trade.scalper.core.Symbol;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 一笔已完成交易的日志记录
 * balance 查询失败时为 null
 */
public record TradeRecord(Instant timestamp,
                          Symbol symbol,
                          Side side,
                          String reason,
                          BigDecimal price,
                          BigDecimal quantity,
                          BigDecimal investment,
                          BigDecimal pnl,
                          BigDecimal balance) {
}
