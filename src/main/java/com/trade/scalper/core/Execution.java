package com.trade.scalper.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 单笔成交记录
 */
public record Execution(String orderId, String execId, BigDecimal price, BigDecimal quantity,
                        BigDecimal fee, Instant execTime) {
}
