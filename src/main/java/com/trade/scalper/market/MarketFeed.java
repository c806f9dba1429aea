package com.trade.scalper.market;

import com.trade.scalper.core.KLine;
import com.trade.scalper.core.Tick;
import com.trade.scalper.core.Ticker;
import com.trade.scalper.exchange.Exchange;
import com.trade.scalper.exchange.ExchangeErrorClassifier;
import com.trade.scalper.exchange.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 行情源
 * 主通道为推送订阅，看门狗发现推送静默超过阈值或连接故障时，切换到 REST 轮询。
 * 切换是单向的，轮询期间不再尝试恢复推送。
 * 最新价模式另有K线刷新任务，按固定间隔通过 REST 补充已收盘K线，供开仓判断使用。
 *
 * 所有事件经同一把锁分发，且只接受与当前状态一致的来源，
 * 因此监听器任一时刻只会被一个生产者调用。
 * 状态切换与后台线程的创建在 lifecycleLock 内完成，stop() 之后不会再有新线程启动。
 */
public class MarketFeed {

    private static final Logger logger = LoggerFactory.getLogger(MarketFeed.class);

    private enum Source {
        PRIMARY,
        FALLBACK,
        CANDLES      // 最新价模式下的K线刷新，推送与轮询阶段都接受
    }

    private final Exchange exchange;
    private final PushStream pushStream;
    private final FeedConfig config;
    private final Clock clock;

    private final AtomicReference<FeedState> state = new AtomicReference<>(FeedState.DISCONNECTED);
    private final Object dispatchLock = new Object();
    private final Object lifecycleLock = new Object();

    private volatile MarketDataListener listener;
    private volatile Instant lastEventAt;
    private volatile PushSubscription subscription;
    private volatile ScheduledExecutorService watchdogExecutor;
    private volatile ScheduledExecutorService pollExecutor;
    private volatile ScheduledExecutorService candleExecutor;

    // 仅在 dispatchLock 内读写
    private Instant lastDeliveredOpenTime;

    public MarketFeed(Exchange exchange, PushStream pushStream, FeedConfig config, Clock clock) {
        this.exchange = exchange;
        this.pushStream = pushStream;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 启动行情源；模拟盘直接进入轮询
     */
    public void start(MarketDataListener listener) {
        synchronized (lifecycleLock) {
            if (state.get() != FeedState.DISCONNECTED || this.listener != null) {
                throw new IllegalStateException("行情源不可重复启动");
            }
            this.listener = listener;
            this.lastEventAt = clock.instant();

            if (config.isStartInFallback()) {
                logger.info("{} 模拟盘不提供推送行情，直接使用 REST 轮询", config.getSymbol());
                state.set(FeedState.STREAMING_FALLBACK);
                startPolling();
                startCandleRefresh();
                return;
            }
            state.set(FeedState.STREAMING_PRIMARY);
            startCandleRefresh();
        }

        PushSubscription created;
        try {
            created = pushStream.subscribe(config.getMode(), config.getSymbol(), config.getInterval(),
                    new PrimaryHandler());
        } catch (RuntimeException e) {
            logger.warn("{} 推送订阅失败 [{}]，切换到 REST 轮询",
                    config.getSymbol(), ExchangeErrorClassifier.summarize(e));
            switchToFallback("推送订阅失败");
            return;
        }

        synchronized (lifecycleLock) {
            if (state.get() == FeedState.STREAMING_PRIMARY) {
                subscription = created;
                startWatchdog();
                logger.info("{} 推送行情已启动，模式 {}，静默阈值 {}ms",
                        config.getSymbol(), config.getMode(), config.getStalenessThreshold().toMillis());
                return;
            }
        }
        // 订阅返回前已经切换或停止
        closeQuietly(created);
    }

    /**
     * 停止行情源：先关闭推送，再在限定时间内结束看门狗、轮询与K线刷新线程
     */
    public void stop() {
        ScheduledExecutorService watchdog;
        ScheduledExecutorService poller;
        ScheduledExecutorService candles;
        synchronized (lifecycleLock) {
            FeedState previous = state.getAndSet(FeedState.DISCONNECTED);
            if (previous == FeedState.DISCONNECTED) {
                return;
            }
            watchdog = watchdogExecutor;
            poller = pollExecutor;
            candles = candleExecutor;
        }
        closeSubscription();
        shutdown(watchdog, "看门狗");
        shutdown(poller, "轮询");
        shutdown(candles, "K线刷新");
        logger.info("{} 行情源已停止", config.getSymbol());
    }

    public FeedState getState() {
        return state.get();
    }

    public Instant getLastEventAt() {
        return lastEventAt;
    }

    /**
     * 已创建的后台线程是否全部结束
     */
    boolean isBackgroundTerminated() {
        return isTerminated(watchdogExecutor) && isTerminated(pollExecutor) && isTerminated(candleExecutor);
    }

    private static boolean isTerminated(ScheduledExecutorService executor) {
        return executor == null || executor.isTerminated();
    }

    /**
     * 看门狗一次检查
     */
    void runWatchdogCheck() {
        try {
            if (state.get() != FeedState.STREAMING_PRIMARY) {
                return;
            }
            Duration silence = Duration.between(lastEventAt, clock.instant());
            if (silence.compareTo(config.getStalenessThreshold()) > 0) {
                StaleFeedException stale = new StaleFeedException(
                        config.getSymbol(), silence, config.getStalenessThreshold());
                logger.warn("{}，切换到 REST 轮询", stale.getMessage());
                if (switchToFallback("推送静默")) {
                    notifyError(stale);
                }
            }
        } catch (RuntimeException e) {
            logger.error("看门狗检查异常", e);
        }
    }

    /**
     * 轮询一次
     */
    void runPollOnce() {
        if (state.get() != FeedState.STREAMING_FALLBACK) {
            return;
        }
        try {
            if (config.getMode() == FeedMode.TICKER) {
                Ticker ticker = exchange.getTicker(config.getSymbol());
                dispatchTick(Source.FALLBACK, ticker.toTick());
            } else {
                List<KLine> kLines = exchange.getKLines(
                        config.getSymbol(), config.getInterval(), config.getPollKLineLimit());
                for (KLine kLine : kLines) {
                    dispatchKLine(Source.FALLBACK, confirmByClock(kLine));
                }
            }
        } catch (ExchangeException e) {
            logger.warn("{} REST 轮询失败 [{}]: {}", config.getSymbol(), e.getErrorCode(), e.getMessage());
            notifyError(e);
        } catch (RuntimeException e) {
            logger.error("{} REST 轮询异常", config.getSymbol(), e);
            notifyError(e);
        }
    }

    /**
     * 最新价模式下刷新一次已收盘K线
     */
    void runCandleRefreshOnce() {
        FeedState current = state.get();
        if (current != FeedState.STREAMING_PRIMARY && current != FeedState.STREAMING_FALLBACK) {
            return;
        }
        try {
            List<KLine> kLines = exchange.getKLines(
                    config.getSymbol(), config.getInterval(), config.getPollKLineLimit());
            for (KLine kLine : kLines) {
                dispatchKLine(Source.CANDLES, confirmByClock(kLine));
            }
        } catch (ExchangeException e) {
            logger.warn("{} K线刷新失败 [{}]: {}", config.getSymbol(), e.getErrorCode(), e.getMessage());
            notifyError(e);
        } catch (RuntimeException e) {
            logger.error("{} K线刷新异常", config.getSymbol(), e);
            notifyError(e);
        }
    }

    /**
     * 开盘时间 + 周期 ≤ 当前时间的K线视为已收盘
     */
    private KLine confirmByClock(KLine kLine) {
        if (kLine.isConfirmed()) {
            return kLine;
        }
        Instant nextOpen = kLine.getOpenTime().plus(kLine.getInterval().getDuration());
        return nextOpen.isAfter(clock.instant()) ? kLine : kLine.withConfirmed(true);
    }

    private boolean switchToFallback(String reason) {
        if (!state.compareAndSet(FeedState.STREAMING_PRIMARY, FeedState.STREAMING_FALLBACK)) {
            return false;
        }
        logger.warn("{} 行情切换: {} → {}，原因: {}，最后事件时间 {}",
                config.getSymbol(), FeedState.STREAMING_PRIMARY, FeedState.STREAMING_FALLBACK,
                reason, lastEventAt);
        closeSubscription();
        ScheduledExecutorService watchdog;
        synchronized (lifecycleLock) {
            watchdog = watchdogExecutor;
            // 关闭订阅期间可能已经 stop()
            if (state.get() == FeedState.STREAMING_FALLBACK) {
                startPolling();
            }
        }
        if (watchdog != null) {
            watchdog.shutdown();
        }
        return true;
    }

    // 以下 start* 方法只在 lifecycleLock 内调用

    private void startWatchdog() {
        long periodMs = config.getWatchdogInterval().toMillis();
        watchdogExecutor = newExecutor("feed-watchdog");
        watchdogExecutor.scheduleWithFixedDelay(this::runWatchdogCheck, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private void startPolling() {
        long periodMs = config.getPollInterval().toMillis();
        pollExecutor = newExecutor("feed-poller");
        pollExecutor.scheduleWithFixedDelay(this::runPollOnce, 0L, periodMs, TimeUnit.MILLISECONDS);
        logger.info("{} REST 轮询已启动，间隔 {}ms", config.getSymbol(), periodMs);
    }

    private void startCandleRefresh() {
        if (config.getMode() != FeedMode.TICKER) {
            return;
        }
        long periodMs = config.getCandleRefreshInterval().toMillis();
        candleExecutor = newExecutor("feed-candles");
        candleExecutor.scheduleWithFixedDelay(this::runCandleRefreshOnce, 0L, periodMs, TimeUnit.MILLISECONDS);
        logger.info("{} K线刷新已启动，间隔 {}ms", config.getSymbol(), periodMs);
    }

    private ScheduledExecutorService newExecutor(String threadName) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    private void closeSubscription() {
        PushSubscription current;
        synchronized (lifecycleLock) {
            current = subscription;
            subscription = null;
        }
        if (current != null) {
            closeQuietly(current);
        }
    }

    private void closeQuietly(PushSubscription target) {
        try {
            target.close();
        } catch (RuntimeException e) {
            logger.warn("关闭推送订阅失败: {}", ExchangeErrorClassifier.summarize(e));
        }
    }

    private void shutdown(ScheduledExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getJoinTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("{}线程未在 {}ms 内结束，强制中断", name, config.getJoinTimeout().toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private boolean accepts(Source source) {
        FeedState current = state.get();
        return (source == Source.PRIMARY && current == FeedState.STREAMING_PRIMARY)
                || (source == Source.FALLBACK && current == FeedState.STREAMING_FALLBACK)
                || (source == Source.CANDLES && current != FeedState.DISCONNECTED);
    }

    private void dispatchTick(Source source, Tick tick) {
        synchronized (dispatchLock) {
            if (!accepts(source)) {
                return;
            }
            lastEventAt = clock.instant();
            try {
                listener.onTick(tick);
            } catch (RuntimeException e) {
                logger.error("行情回调异常: {}", tick, e);
                forwardError(e);
            }
        }
    }

    private void dispatchKLine(Source source, KLine kLine) {
        synchronized (dispatchLock) {
            if (!accepts(source)) {
                return;
            }
            // 未收盘的更新同样证明通道存活；REST 补充的K线不计入
            if (source != Source.CANDLES) {
                lastEventAt = clock.instant();
            }
            if (!kLine.isConfirmed()) {
                return;
            }
            if (lastDeliveredOpenTime != null && !kLine.getOpenTime().isAfter(lastDeliveredOpenTime)) {
                return;
            }
            lastDeliveredOpenTime = kLine.getOpenTime();
            try {
                listener.onKLine(kLine);
            } catch (RuntimeException e) {
                logger.error("行情回调异常: {}", kLine, e);
                forwardError(e);
            }
        }
    }

    private void notifyError(Throwable error) {
        synchronized (dispatchLock) {
            if (state.get() == FeedState.DISCONNECTED) {
                return;
            }
            forwardError(error);
        }
    }

    private void forwardError(Throwable error) {
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            logger.error("错误回调异常", e);
        }
    }

    private final class PrimaryHandler implements PushStream.Handler {

        @Override
        public void onTick(Tick tick) {
            dispatchTick(Source.PRIMARY, tick);
        }

        @Override
        public void onKLine(KLine kLine) {
            dispatchKLine(Source.PRIMARY, kLine);
        }

        @Override
        public void onFailure(Throwable cause) {
            if (state.get() != FeedState.STREAMING_PRIMARY) {
                return;
            }
            logger.warn("{} 推送连接故障: {}", config.getSymbol(), ExchangeErrorClassifier.summarize(cause));
            if (switchToFallback("推送连接故障")) {
                notifyError(cause);
            }
        }
    }
}
