package com.trade.scalper.execution;

/**
 * 可卖数量不满足交易规则，订单未发送
 */
public class InsufficientBalanceException extends ExecutionException {

    public InsufficientBalanceException(String message) {
        super(message);
    }
}
