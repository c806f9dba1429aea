package com.trade.scalper.market;

import com.trade.scalper.core.Interval;
import com.trade.scalper.core.KLine;
import com.trade.scalper.core.Symbol;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 OkHttp WebSocket 的 Bybit v5 现货公共推送
 * 每个订阅独占一条连接和一个心跳任务。
 */
public class BybitPublicStream implements PushStream {

    private static final Logger logger = LoggerFactory.getLogger(BybitPublicStream.class);

    private static final Duration PING_INTERVAL = Duration.ofSeconds(20);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String url;

    public BybitPublicStream(OkHttpClient httpClient, ObjectMapper objectMapper, String url) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.url = url;
    }

    @Override
    public PushSubscription subscribe(FeedMode mode, Symbol symbol, Interval interval, Handler handler) {
        String topic = BybitStreamParser.topicFor(mode, symbol, interval);
        BybitStreamParser parser = new BybitStreamParser(objectMapper, symbol, interval);
        SocketSubscription subscription = new SocketSubscription(topic, parser, handler);
        subscription.open();
        return subscription;
    }

    private final class SocketSubscription extends WebSocketListener implements PushSubscription {
        private final String topic;
        private final BybitStreamParser parser;
        private final Handler handler;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final ScheduledExecutorService pinger;
        private volatile WebSocket webSocket;

        private SocketSubscription(String topic, BybitStreamParser parser, Handler handler) {
            this.topic = topic;
            this.parser = parser;
            this.handler = handler;
            this.pinger = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "bybit-ws-ping");
                t.setDaemon(true);
                return t;
            });
        }

        private void open() {
            logger.info("连接推送行情 {} 主题 {}", url, topic);
            webSocket = httpClient.newWebSocket(new Request.Builder().url(url).build(), this);
            pinger.scheduleAtFixedRate(this::ping,
                    PING_INTERVAL.toMillis(), PING_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        }

        private void ping() {
            WebSocket ws = webSocket;
            if (ws != null && !closed.get()) {
                ws.send("{\"op\":\"ping\"}");
            }
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            String payload = "{\"op\":\"subscribe\",\"args\":[\"" + topic + "\"]}";
            if (!webSocket.send(payload)) {
                fail(new IOException("订阅消息发送失败: " + topic));
            }
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            if (closed.get()) {
                return;
            }
            BybitStreamParser.Message message;
            try {
                message = parser.parse(text);
            } catch (IOException | RuntimeException e) {
                logger.error("推送消息解析失败: {}", text, e);
                return;
            }
            switch (message.kind()) {
                case TICK -> handler.onTick(message.tick());
                case KLINES -> {
                    for (KLine kLine : message.kLines()) {
                        handler.onKLine(kLine);
                    }
                }
                case SUBSCRIBED -> logger.info("推送订阅成功: {}", topic);
                case SUBSCRIBE_FAILED -> fail(new IOException("推送订阅被拒绝: " + message.detail()));
                default -> {
                }
            }
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(code, reason);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            fail(new IOException("推送连接已关闭: code=" + code + ", reason=" + reason));
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            fail(t);
        }

        private void fail(Throwable cause) {
            if (closed.get()) {
                return;
            }
            handler.onFailure(cause);
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            pinger.shutdownNow();
            WebSocket ws = webSocket;
            if (ws != null) {
                ws.close(1000, "client close");
            }
        }
    }
}
