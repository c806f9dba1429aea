package com.trade.scalper.market;

/**
 * 推送订阅句柄
 */
public interface PushSubscription extends AutoCloseable {

    /**
     * 关闭订阅，重复调用无副作用
     */
    @Override
    void close();
}
