package com.trade.scalper.market;

import com.trade.scalper.MutableClock;
import com.trade.scalper.core.*;
import com.trade.scalper.exchange.FakeExchange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MarketFeedTest {

    private static final Symbol SYMBOL = Symbol.of("BTCUSDT");
    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final FakeExchange exchange = new FakeExchange();
    private final FakePushStream pushStream = new FakePushStream();
    private final RecordingListener listener = new RecordingListener();
    private MarketFeed feed;

    @AfterEach
    void tearDown() {
        if (feed != null) {
            feed.stop();
        }
    }

    @Test
    void watchdog_shouldSwitchToFallbackOnlyAfterThreshold() {
        exchange.ticker = new Ticker(SYMBOL, null, null, new BigDecimal("100"), START);
        feed = newFeed(FeedMode.TICKER, false);
        feed.start(listener);
        pushStream.handler.onTick(new Tick(SYMBOL, new BigDecimal("99"), START));

        clock.advance(Duration.ofSeconds(8));
        feed.runWatchdogCheck();
        assertEquals(FeedState.STREAMING_PRIMARY, feed.getState());

        clock.advance(Duration.ofMillis(1));
        feed.runWatchdogCheck();
        assertEquals(FeedState.STREAMING_FALLBACK, feed.getState());
        assertTrue(pushStream.subscription.closed);
        assertTrue(listener.errors.stream().anyMatch(e -> e instanceof StaleFeedException));
    }

    @Test
    void watchdog_shouldStayOnPrimaryWhileEventsArrive() {
        feed = newFeed(FeedMode.TICKER, false);
        feed.start(listener);

        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofSeconds(5));
            pushStream.handler.onTick(new Tick(SYMBOL, new BigDecimal("100"), clock.instant()));
            feed.runWatchdogCheck();
        }

        assertEquals(FeedState.STREAMING_PRIMARY, feed.getState());
        assertEquals(5, listener.ticks.size());
        assertEquals(clock.instant(), feed.getLastEventAt());
    }

    @Test
    void primaryFailure_shouldSwitchToFallbackAndIgnoreLatePrimaryEvents() throws Exception {
        exchange.ticker = new Ticker(SYMBOL, null, null, new BigDecimal("100"), START);
        feed = newFeed(FeedMode.TICKER, false);
        feed.start(listener);
        PushStream.Handler handler = pushStream.handler;

        RuntimeException failure = new RuntimeException("socket closed");
        handler.onFailure(failure);
        handler.onTick(new Tick(SYMBOL, new BigDecimal("999"), START));

        assertEquals(FeedState.STREAMING_FALLBACK, feed.getState());
        assertTrue(listener.errors.contains(failure));
        waitFor(() -> !listener.ticks.isEmpty());
        assertTrue(listener.ticks.stream().noneMatch(t -> t.getPrice().compareTo(new BigDecimal("999")) == 0));
        assertTrue(listener.ticks.stream().allMatch(t -> t.getPrice().compareTo(new BigDecimal("100")) == 0));
    }

    @Test
    void subscribeError_shouldStartInFallback() {
        pushStream.subscribeError = new IllegalStateException("handshake failed");
        exchange.ticker = new Ticker(SYMBOL, null, null, new BigDecimal("100"), START);
        feed = newFeed(FeedMode.TICKER, false);

        feed.start(listener);

        assertEquals(FeedState.STREAMING_FALLBACK, feed.getState());
    }

    @Test
    void demoEnvironment_shouldPollWithoutSubscribing() throws Exception {
        Instant open = START.minusSeconds(120);
        exchange.kLines = List.of(kLine(open, false), kLine(open.plusSeconds(60), false), kLine(START, false));
        feed = newFeed(FeedMode.KLINE, true);

        feed.start(listener);

        assertEquals(FeedState.STREAMING_FALLBACK, feed.getState());
        assertEquals(0, pushStream.subscribeCalls);
        waitFor(() -> listener.kLines.size() >= 2);
        // 最后一根仍在进行中，不会下发
        assertEquals(2, listener.kLines.size());
        assertTrue(listener.kLines.get(0).isConfirmed());
    }

    @Test
    void primaryKLines_shouldDeliverEachConfirmedCandleOnce() {
        feed = newFeed(FeedMode.KLINE, false);
        feed.start(listener);
        Instant open = START.minusSeconds(60);

        clock.advance(Duration.ofSeconds(5));
        pushStream.handler.onKLine(kLine(open, false));
        assertEquals(clock.instant(), feed.getLastEventAt());
        assertTrue(listener.kLines.isEmpty());

        pushStream.handler.onKLine(kLine(open, true));
        pushStream.handler.onKLine(kLine(open, true));
        pushStream.handler.onKLine(kLine(open.minusSeconds(60), true));

        assertEquals(1, listener.kLines.size());
    }

    @Test
    void listenerException_shouldBeForwardedAsError() {
        RecordingListener throwing = new RecordingListener() {
            @Override
            public void onTick(Tick tick) {
                throw new IllegalStateException("boom");
            }
        };
        feed = newFeed(FeedMode.TICKER, false);
        feed.start(throwing);

        pushStream.handler.onTick(new Tick(SYMBOL, BigDecimal.ONE, START));

        assertEquals(FeedState.STREAMING_PRIMARY, feed.getState());
        assertEquals(1, throwing.errors.size());
        assertTrue(throwing.errors.get(0) instanceof IllegalStateException);
    }

    @Test
    void stop_shouldCloseSubscriptionAndDisconnect() {
        feed = newFeed(FeedMode.KLINE, false);
        feed.start(listener);

        feed.stop();

        assertEquals(FeedState.DISCONNECTED, feed.getState());
        assertTrue(pushStream.subscription.closed);
        pushStream.handler.onKLine(kLine(START.minusSeconds(60), true));
        assertTrue(listener.kLines.isEmpty());
    }

    @Test
    void start_shouldRejectSecondStart() {
        feed = newFeed(FeedMode.KLINE, false);
        feed.start(listener);

        assertThrows(IllegalStateException.class, () -> feed.start(listener));
    }

    @Test
    void stop_shouldEndWatchdogAndPollerWithinJoinTimeout() throws Exception {
        exchange.ticker = new Ticker(SYMBOL, null, null, new BigDecimal("100"), START);
        FeedConfig config = FeedConfig.builder()
                .symbol(SYMBOL)
                .mode(FeedMode.TICKER)
                .stalenessThreshold(Duration.ofMillis(50))
                .watchdogInterval(Duration.ofMillis(20))
                .pollInterval(Duration.ofMillis(20))
                .candleRefreshInterval(Duration.ofMillis(20))
                .joinTimeout(Duration.ofSeconds(1))
                .build();
        feed = new MarketFeed(exchange, pushStream, config, Clock.systemUTC());
        feed.start(listener);

        // 推送无事件，看门狗切到轮询后轮询线程开始下发
        waitFor(() -> feed.getState() == FeedState.STREAMING_FALLBACK);
        waitFor(() -> listener.ticks.size() >= 3);

        long begin = System.nanoTime();
        feed.stop();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertTrue(elapsedMs < 1000, "stop took " + elapsedMs + "ms");
        assertTrue(feed.isBackgroundTerminated());
        int delivered = listener.ticks.size();
        int polls = exchange.tickerCalls;
        Thread.sleep(100);
        assertEquals(delivered, listener.ticks.size());
        assertEquals(polls, exchange.tickerCalls);
    }

    @Test
    void stop_duringFallbackSwitch_shouldNotStartPoller() throws Exception {
        CountDownLatch closing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        pushStream.nextSubscription = () -> {
            closing.countDown();
            try {
                release.await(3, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        feed = newFeed(FeedMode.KLINE, false);
        feed.start(listener);

        Thread failure = new Thread(() -> pushStream.handler.onFailure(new RuntimeException("socket reset")),
                "socket-failure");
        failure.start();
        assertTrue(closing.await(3, TimeUnit.SECONDS));

        feed.stop();
        release.countDown();
        failure.join(3000);

        assertFalse(failure.isAlive());
        assertEquals(FeedState.DISCONNECTED, feed.getState());
        assertTrue(feed.isBackgroundTerminated());
        assertEquals(0, exchange.kLineCalls);
    }

    @Test
    void fallbackPolling_shouldDeliverOverlappingCandlesOnceInOrder() throws Exception {
        Instant t = START;
        exchange.kLineBatches.add(List.of(kLine(t.minusSeconds(240), false), kLine(t.minusSeconds(180), false),
                kLine(t.minusSeconds(120), false)));
        exchange.kLineBatches.add(List.of(kLine(t.minusSeconds(180), false), kLine(t.minusSeconds(120), false),
                kLine(t.minusSeconds(60), false)));
        exchange.kLineBatches.add(List.of(kLine(t.minusSeconds(120), false), kLine(t.minusSeconds(60), false),
                kLine(t, false)));
        FeedConfig config = FeedConfig.builder()
                .symbol(SYMBOL)
                .mode(FeedMode.KLINE)
                .pollInterval(Duration.ofMillis(20))
                .joinTimeout(Duration.ofSeconds(1))
                .startInFallback(true)
                .build();
        feed = new MarketFeed(exchange, pushStream, config, clock);

        feed.start(listener);
        waitFor(() -> exchange.kLineCalls >= 5);

        List<Instant> opens = listener.kLines.stream().map(KLine::getOpenTime).collect(Collectors.toList());
        assertEquals(List.of(t.minusSeconds(240), t.minusSeconds(180), t.minusSeconds(120), t.minusSeconds(60)),
                opens);
        assertTrue(listener.kLines.stream().allMatch(KLine::isConfirmed));
    }

    @Test
    void tickerMode_shouldSupplyConfirmedCandlesWithoutCountingAsPushActivity() throws Exception {
        exchange.ticker = new Ticker(SYMBOL, null, null, new BigDecimal("100"), START);
        exchange.kLines = List.of(kLine(START.minusSeconds(120), true), kLine(START.minusSeconds(60), true),
                kLine(START, false));
        feed = newFeed(FeedMode.TICKER, false);
        feed.start(listener);

        feed.runCandleRefreshOnce();
        waitFor(() -> listener.kLines.size() == 2);

        assertEquals(START.minusSeconds(60), listener.kLines.get(1).getOpenTime());
        assertEquals(START, feed.getLastEventAt());

        clock.advance(Duration.ofSeconds(9));
        feed.runCandleRefreshOnce();
        feed.runWatchdogCheck();
        assertEquals(FeedState.STREAMING_FALLBACK, feed.getState());
        assertEquals(2, listener.kLines.size());
    }

    @Test
    void klineMode_shouldNotRunCandleRefresh() {
        feed = newFeed(FeedMode.KLINE, false);
        feed.start(listener);

        feed.stop();

        assertEquals(0, exchange.kLineCalls);
    }

    private MarketFeed newFeed(FeedMode mode, boolean demo) {
        FeedConfig config = FeedConfig.builder()
                .symbol(SYMBOL)
                .interval(Interval.ONE_MINUTE)
                .mode(mode)
                .stalenessThreshold(Duration.ofSeconds(8))
                .watchdogInterval(Duration.ofHours(1))
                .pollInterval(Duration.ofHours(1))
                .candleRefreshInterval(Duration.ofHours(1))
                .joinTimeout(Duration.ofSeconds(1))
                .startInFallback(demo)
                .build();
        return new MarketFeed(exchange, pushStream, config, clock);
    }

    private static KLine kLine(Instant open, boolean confirmed) {
        BigDecimal price = new BigDecimal("100");
        return new KLine(SYMBOL, Interval.ONE_MINUTE, open, open.plusSeconds(60).minusMillis(1),
                price, price, price, price, BigDecimal.ONE, price, confirmed);
    }

    private static void waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean(), "condition not met within 3s");
    }

    private static class RecordingListener implements MarketDataListener {
        final List<KLine> kLines = new CopyOnWriteArrayList<>();
        final List<Tick> ticks = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onKLine(KLine kLine) {
            kLines.add(kLine);
        }

        @Override
        public void onTick(Tick tick) {
            ticks.add(tick);
        }

        @Override
        public void onError(Throwable throwable) {
            errors.add(throwable);
        }
    }

    private static final class FakeSubscription implements PushSubscription {
        volatile boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }

    private static final class FakePushStream implements PushStream {
        volatile Handler handler;
        volatile FakeSubscription subscription;
        volatile PushSubscription nextSubscription;
        RuntimeException subscribeError;
        int subscribeCalls;

        @Override
        public PushSubscription subscribe(FeedMode mode, Symbol symbol, Interval interval, Handler handler) {
            subscribeCalls++;
            if (subscribeError != null) {
                throw subscribeError;
            }
            this.handler = handler;
            if (nextSubscription != null) {
                return nextSubscription;
            }
            this.subscription = new FakeSubscription();
            return subscription;
        }
    }
}
