package com.trade.scalper;

import com.trade.scalper.core.*;
import com.trade.scalper.market.FeedConfig;
import com.trade.scalper.market.FeedMode;
import com.trade.scalper.strategy.ScalpingConfig;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

/**
 * 机器人运行参数，由 {@link ConfigManager} 读取并校验
 */
public class BotSettings {

    private final String apiKey;
    private final String apiSecret;
    private final TradingEnvironment environment;
    private final AccountType accountType;
    private final long recvWindowMs;
    private final Duration httpTimeout;
    private final Symbol symbol;
    private final String category;
    private final FeedConfig feedConfig;
    private final ScalpingConfig scalpingConfig;
    private final int windowSize;
    private final BigDecimal quoteBuffer;
    private final int fillPollAttempts;
    private final Duration fillPollDelay;
    private final Path journalPath;

    private BotSettings(ConfigManager config) {
        if (!config.hasProperty("bybit.api.key") || !config.hasProperty("bybit.api.secret")) {
            throw new IllegalStateException("缺少 API 凭证，请设置 BYBIT_API_KEY 与 BYBIT_API_SECRET");
        }
        this.apiKey = config.getProperty("bybit.api.key");
        this.apiSecret = config.getProperty("bybit.api.secret");
        this.environment = TradingEnvironment.fromCode(config.getProperty("bybit.env", "DEMO"));
        this.accountType = AccountType.fromCode(config.getProperty("bybit.account.type", "UNIFIED"));
        this.recvWindowMs = config.getLongProperty("bybit.recv.window", 5000L);
        this.httpTimeout = Duration.ofSeconds(config.getLongProperty("bybit.http.timeout.seconds", 20L));
        this.symbol = Symbol.of(config.getProperty("trade.symbol", "BTCUSDT"));
        this.category = config.getProperty("trade.category", "spot");

        FeedMode mode = FeedMode.valueOf(config.getProperty("feed.mode", "KLINE").toUpperCase(Locale.ROOT));
        FeedConfig.Builder feed = FeedConfig.builder()
                .symbol(symbol)
                .interval(Interval.fromCode(config.getProperty("feed.interval", "1m")))
                .mode(mode)
                .watchdogInterval(Duration.ofMillis(config.getLongProperty("feed.watchdog.interval.ms", 2000L)))
                .joinTimeout(Duration.ofMillis(config.getLongProperty("feed.join.timeout.ms", 2000L)))
                .candleRefreshInterval(Duration.ofMillis(config.getLongProperty("feed.candle.refresh.ms", 30000L)))
                .startInFallback(environment.isDemo());
        if (config.hasProperty("feed.staleness.ms")) {
            feed.stalenessThreshold(Duration.ofMillis(config.getLongProperty("feed.staleness.ms", 0L)));
        }
        if (config.hasProperty("feed.poll.interval.ms")) {
            feed.pollInterval(Duration.ofMillis(config.getLongProperty("feed.poll.interval.ms", 0L)));
        }
        this.feedConfig = feed.build();

        this.scalpingConfig = ScalpingConfig.builder()
                .riskPerTrade(config.getDecimalProperty("strategy.risk.per.trade", BigDecimal.valueOf(5)))
                .takeProfitPct(config.getDecimalProperty("strategy.take.profit.pct", new BigDecimal("0.003")))
                .stopLossPct(config.getDecimalProperty("strategy.stop.loss.pct", new BigDecimal("0.005")))
                .atrMultiplier(config.getDecimalProperty("strategy.atr.multiplier", new BigDecimal("1.5")))
                .maxOpenDuration(Duration.ofMinutes(config.getLongProperty("strategy.max.open.minutes", 20L)))
                .adxThreshold(config.getDecimalProperty("strategy.adx.threshold", BigDecimal.valueOf(25)))
                .rsiThreshold(config.getDecimalProperty("strategy.rsi.threshold", BigDecimal.valueOf(68)))
                .volumeMultiplier(config.getDecimalProperty("strategy.volume.multiplier", new BigDecimal("1.2")))
                .entryCooldown(Duration.ofSeconds(config.getLongProperty("strategy.cooldown.seconds", 60L)))
                .build();
        this.windowSize = config.getIntProperty("strategy.window.size", 1000);

        this.quoteBuffer = config.getDecimalProperty("order.quote.buffer", BigDecimal.ONE);
        if (quoteBuffer.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalStateException("order.quote.buffer 不能小于 1");
        }
        this.fillPollAttempts = config.getIntProperty("order.fill.poll.attempts", 5);
        this.fillPollDelay = Duration.ofMillis(config.getLongProperty("order.fill.poll.delay.ms", 300L));
        this.journalPath = Paths.get(config.getProperty("journal.path", "trades.csv"));
    }

    public static BotSettings from(ConfigManager config) {
        return new BotSettings(config);
    }

    public String getApiKey() { return apiKey; }
    public String getApiSecret() { return apiSecret; }
    public TradingEnvironment getEnvironment() { return environment; }
    public AccountType getAccountType() { return accountType; }
    public long getRecvWindowMs() { return recvWindowMs; }
    public Duration getHttpTimeout() { return httpTimeout; }
    public Symbol getSymbol() { return symbol; }
    public String getCategory() { return category; }
    public FeedConfig getFeedConfig() { return feedConfig; }
    public ScalpingConfig getScalpingConfig() { return scalpingConfig; }
    public int getWindowSize() { return windowSize; }
    public BigDecimal getQuoteBuffer() { return quoteBuffer; }
    public int getFillPollAttempts() { return fillPollAttempts; }
    public Duration getFillPollDelay() { return fillPollDelay; }
    public Path getJournalPath() { return journalPath; }

    /**
     * 模拟盘不接受 marketUnit 参数
     */
    public boolean isMarketUnitSupported() {
        return !environment.isDemo();
    }

    @Override
    public String toString() {
        return String.format("BotSettings{env=%s, account=%s, symbol=%s, feed=%s/%s, %s}",
                environment, accountType, symbol, feedConfig.getMode(), feedConfig.getInterval().getCode(),
                scalpingConfig);
    }
}
