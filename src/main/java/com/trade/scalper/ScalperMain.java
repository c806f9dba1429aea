package com.trade.scalper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.scalper.core.ConfigManager;
import com.trade.scalper.core.OpenOrder;
import com.trade.scalper.core.Symbol;
import com.trade.scalper.core.WalletBalance;
import com.trade.scalper.exchange.Exchange;
import com.trade.scalper.exchange.ExchangeException;
import com.trade.scalper.exchange.ExchangeFactory;
import com.trade.scalper.execution.CsvTradeJournal;
import com.trade.scalper.execution.ExecutionException;
import com.trade.scalper.execution.OrderManager;
import com.trade.scalper.execution.TradeEngine;
import com.trade.scalper.indicator.KLineIndicatorCalculator;
import com.trade.scalper.market.BybitPublicStream;
import com.trade.scalper.market.FeedConfig;
import com.trade.scalper.market.KLineWindow;
import com.trade.scalper.market.MarketFeed;
import com.trade.scalper.strategy.ScalpingStrategy;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * 现货剥头皮机器人入口
 */
public class ScalperMain {

    private static final Logger logger = LoggerFactory.getLogger(ScalperMain.class);

    private static final int WARM_UP_BARS = 200;

    public static void main(String[] args) {
        BotSettings settings;
        try {
            settings = BotSettings.from(ConfigManager.getInstance());
        } catch (RuntimeException e) {
            logger.error("配置无效: {}", e.getMessage());
            System.exit(1);
            return;
        }
        logger.info("启动参数: {}", settings);

        Clock clock = Clock.systemUTC();
        ObjectMapper objectMapper = new ObjectMapper();
        OkHttpClient httpClient = ExchangeFactory.createHttpClient(settings.getHttpTimeout());
        Exchange exchange = ExchangeFactory.createBybit(httpClient, objectMapper,
                settings.getEnvironment(), settings.getApiKey(), settings.getApiSecret(),
                settings.getRecvWindowMs(), settings.getAccountType(), settings.getCategory());

        Symbol symbol = settings.getSymbol();
        try {
            WalletBalance balance = exchange.getWalletBalance(List.of(symbol.getQuote(), symbol.getBase()));
            logger.info("{} 账户余额: {}", settings.getEnvironment(), balance);
        } catch (ExchangeException e) {
            logger.error("启动时余额校验失败 [{}] code={}: {}",
                    e.getErrorCode(), e.getExchangeCode(), e.getMessage());
            System.exit(1);
            return;
        }

        OrderManager orderManager = new OrderManager(exchange, symbol, settings.isMarketUnitSupported(),
                settings.getQuoteBuffer(), settings.getFillPollAttempts(), settings.getFillPollDelay(),
                Thread::sleep);
        try {
            List<OpenOrder> openOrders = orderManager.openOrders();
            if (!openOrders.isEmpty()) {
                logger.warn("{} 启动时存在 {} 笔未完成订单，机器人不会管理这些订单: {}",
                        symbol, openOrders.size(), openOrders);
            }
        } catch (ExecutionException e) {
            logger.warn("启动时查询挂单失败: {}", e.getMessage());
        }

        TradeEngine engine = new TradeEngine(symbol,
                new ScalpingStrategy(settings.getScalpingConfig()),
                orderManager,
                new CsvTradeJournal(settings.getJournalPath()),
                new KLineIndicatorCalculator(),
                new KLineWindow(settings.getWindowSize()),
                clock);

        FeedConfig feedConfig = settings.getFeedConfig();
        try {
            engine.warmUp(exchange.getKLines(symbol, feedConfig.getInterval(), WARM_UP_BARS));
        } catch (ExchangeException e) {
            logger.warn("历史K线加载失败，等待实时行情填充窗口 [{}]: {}", e.getErrorCode(), e.getMessage());
        }

        MarketFeed feed = new MarketFeed(exchange,
                new BybitPublicStream(httpClient, objectMapper, settings.getEnvironment().getPublicStreamUrl()),
                feedConfig, clock);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("收到退出信号，停止行情源");
            feed.stop();
            if (engine.getPosition() != null) {
                logger.warn("退出时仍有持仓: {}", engine.getPosition());
            }
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
            stopped.countDown();
        }, "scalper-shutdown"));

        feed.start(engine);
        logger.info("{} 剥头皮机器人已启动", symbol);

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
