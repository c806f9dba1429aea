package com.trade.scalper.market;

/**
 * 行情源状态，只会按 DISCONNECTED → STREAMING_PRIMARY → STREAMING_FALLBACK 单向推进，stop() 后回到 DISCONNECTED
 */
public enum FeedState {
    DISCONNECTED,
    STREAMING_PRIMARY,     // WebSocket 推送
    STREAMING_FALLBACK     // REST 轮询
}
