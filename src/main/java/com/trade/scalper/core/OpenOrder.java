package com.trade.scalper.core;

import java.math.BigDecimal;

/**
 * 未完成订单
 * 市价单 price 为零，非条件单 triggerPrice 为零
 */
public record OpenOrder(String orderId, String orderLinkId, Side side, OrderType type, BigDecimal price,
                        BigDecimal quantity, BigDecimal filledQuantity, BigDecimal triggerPrice, String status) {
}
