package com.trade.scalper.market;

import com.trade.scalper.core.Interval;
import com.trade.scalper.core.KLine;
import com.trade.scalper.core.Symbol;
import com.trade.scalper.core.Tick;

/**
 * 推送行情连接（主通道）
 */
public interface PushStream {

    /**
     * 订阅一个行情主题
     * @throws RuntimeException 无法建立订阅时
     */
    PushSubscription subscribe(FeedMode mode, Symbol symbol, Interval interval, Handler handler);

    /**
     * 推送回调，在推送线程上调用
     */
    interface Handler {

        void onTick(Tick tick);

        /**
         * 包括未收盘的K线更新
         */
        void onKLine(KLine kLine);

        /**
         * 连接断开、订阅被拒绝等传输层故障
         */
        void onFailure(Throwable cause);
    }
}
