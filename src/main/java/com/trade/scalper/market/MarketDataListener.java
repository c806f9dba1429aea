package com.trade.scalper.market;

import com.trade.scalper.core.KLine;
import com.trade.scalper.core.Tick;

/**
 * 行情数据监听器
 * 回调由行情源串行调用，上一次回调返回前不会收到下一次事件
 */
public interface MarketDataListener {

    /**
     * 已确认K线回调
     */
    void onKLine(KLine kLine);

    /**
     * 最新价回调
     */
    void onTick(Tick tick);

    /**
     * 错误回调
     */
    void onError(Throwable throwable);
}
