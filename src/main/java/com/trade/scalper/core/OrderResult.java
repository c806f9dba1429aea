package com.trade.scalper.core;

/**
 * 下单回执
 */
public record OrderResult(String orderId, String orderLinkId) {
}
