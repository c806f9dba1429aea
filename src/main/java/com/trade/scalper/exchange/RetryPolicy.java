package com.trade.scalper.exchange;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * 有界重试策略：最大次数、指数退避、可重试判定
 * 与传输层无关，可单独测试
 */
public final class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_INITIAL_BACKOFF_MS = 800L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 6000L;

    /**
     * 交易所调用
     */
    @FunctionalInterface
    public interface ExchangeCall<T> {
        T call() throws ExchangeException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Predicate<ExchangeException> retryable;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs,
                       Predicate<ExchangeException> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("最大尝试次数必须 >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    /**
     * 3 次尝试，800ms 起步翻倍，封顶 6s，仅重试瞬时故障
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF_MS, DEFAULT_MAX_BACKOFF_MS,
                ExchangeException::isTransient, Thread::sleep);
    }

    /**
     * 同样的次数与退避，替换可重试判定
     */
    public RetryPolicy withRetryable(Predicate<ExchangeException> predicate) {
        return new RetryPolicy(maxAttempts, initialBackoffMs, maxBackoffMs, predicate, sleeper);
    }

    public RetryPolicy withSleeper(Sleeper newSleeper) {
        return new RetryPolicy(maxAttempts, initialBackoffMs, maxBackoffMs, retryable, newSleeper);
    }

    /**
     * 第 attempt 次失败后的等待时间（attempt 从 1 开始）
     */
    public long backoffMillis(int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), 20);
        long delay = initialBackoffMs << shift;
        return Math.min(delay, maxBackoffMs);
    }

    public <T> T execute(String operation, ExchangeCall<T> call) throws ExchangeException {
        ExchangeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (ExchangeException e) {
                last = e;
                if (!retryable.test(e) || attempt >= maxAttempts) {
                    throw e;
                }
                long delay = backoffMillis(attempt);
                logger.warn("{} 第{}次失败 [{}]: {}，{}ms 后重试",
                        operation, attempt, e.getErrorCode(), e.getMessage(), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
        throw last;
    }
}
