package com.trade.scalper.execution;

import com.trade.scalper.MutableClock;
import com.trade.scalper.core.*;
import com.trade.scalper.exchange.ExchangeException;
import com.trade.scalper.exchange.FakeExchange;
import com.trade.scalper.indicator.IndicatorSnapshot;
import com.trade.scalper.indicator.KLineIndicatorCalculator;
import com.trade.scalper.market.KLineWindow;
import com.trade.scalper.strategy.EngineState;
import com.trade.scalper.strategy.ScalpingConfig;
import com.trade.scalper.strategy.ScalpingStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TradeEngineTest {

    private static final Symbol SYMBOL = Symbol.of("BTCUSDT");
    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final FakeExchange exchange = new FakeExchange();
    private final RecordingJournal journal = new RecordingJournal();

    @BeforeEach
    void setUp() {
        exchange.filters = new SymbolFilters(SYMBOL, new BigDecimal("0.0001"), new BigDecimal("0.0001"), null,
                null, new BigDecimal("0.01"), new BigDecimal("0.01"), null, null, new BigDecimal("5"));
        exchange.ticker = new Ticker(SYMBOL, null, null, new BigDecimal("100"), START);
        exchange.balances.put("USDT", new BigDecimal("1000"));
        exchange.balances.put("BTC", new BigDecimal("2"));
    }

    private TradeEngine newEngine(BigDecimal riskPerTrade) {
        ScalpingConfig config = ScalpingConfig.builder().riskPerTrade(riskPerTrade).build();
        OrderManager orderManager = new OrderManager(exchange, SYMBOL, true, BigDecimal.ONE, 1,
                Duration.ZERO, millis -> { });
        return new TradeEngine(SYMBOL, new ScalpingStrategy(config), orderManager, journal,
                new KLineIndicatorCalculator(), new KLineWindow(), clock);
    }

    @Test
    void roundTrip_shouldOpenThenCloseAtTakeProfitAndJournalPnl() {
        TradeEngine engine = newEngine(new BigDecimal("5"));
        exchange.fillNextOrder(new BigDecimal("100"), new BigDecimal("2"));

        engine.evaluateEntry(bullish());

        assertEquals(EngineState.IN_POSITION, engine.getState());
        assertEquals(0, new BigDecimal("100").compareTo(engine.getPosition().getEntryPrice()));
        assertEquals(0, new BigDecimal("99.5").compareTo(engine.getPosition().getStopLossPrice()));
        assertEquals(MarketUnit.QUOTE, exchange.lastOrder().getMarketUnit());

        exchange.ticker = new Ticker(SYMBOL, null, null, new BigDecimal("100.5"), START);
        exchange.fillNextOrder(new BigDecimal("100.5"), new BigDecimal("2"));
        engine.onTick(new Tick(SYMBOL, new BigDecimal("100.5"), START.plusSeconds(30)));

        assertEquals(EngineState.FLAT, engine.getState());
        assertNull(engine.getPosition());
        assertEquals(1, journal.records.size());
        TradeRecord record = journal.records.get(0);
        assertEquals(Side.SELL, record.side());
        assertEquals("tp", record.reason());
        assertEquals(0, new BigDecimal("1.0").compareTo(record.pnl()));
        assertEquals(0, new BigDecimal("200").compareTo(record.investment()));
        assertEquals(0, new BigDecimal("1000").compareTo(record.balance()));
    }

    @Test
    void evaluateEntry_shouldBeNoOpWhileInPosition() {
        TradeEngine engine = newEngine(new BigDecimal("5"));
        exchange.fillNextOrder(new BigDecimal("100"), new BigDecimal("2"));
        engine.evaluateEntry(bullish());

        engine.evaluateEntry(bullish());

        assertEquals(1, exchange.placedOrders.size());
        assertEquals(EngineState.IN_POSITION, engine.getState());
    }

    @Test
    void evaluateEntry_shouldCoolDownAfterUnfilledBuy() {
        TradeEngine engine = newEngine(new BigDecimal("5"));

        engine.evaluateEntry(bullish());

        assertEquals(EngineState.FLAT, engine.getState());
        assertEquals(START.plusSeconds(60), engine.getCooldownUntil());

        clock.advance(Duration.ofSeconds(59));
        engine.evaluateEntry(bullish());
        assertEquals(1, exchange.placedOrders.size());

        clock.advance(Duration.ofSeconds(1));
        engine.evaluateEntry(bullish());
        assertEquals(2, exchange.placedOrders.size());
    }

    @Test
    void evaluateEntry_shouldCoolDownAfterRejectedBuy() {
        TradeEngine engine = newEngine(new BigDecimal("5"));
        exchange.placeOrderError = new ExchangeException(ExchangeException.ErrorCode.REJECTED, 170131,
                "Insufficient balance", null);

        engine.evaluateEntry(bullish());

        assertEquals(EngineState.FLAT, engine.getState());
        assertNotNull(engine.getCooldownUntil());
    }

    @Test
    void evaluateEntry_shouldSkipWhenSpendBelowMinimumOrderValue() {
        TradeEngine engine = newEngine(new BigDecimal("3"));

        engine.evaluateEntry(bullish());

        assertTrue(exchange.placedOrders.isEmpty());
        assertNull(engine.getCooldownUntil());
    }

    @Test
    void evaluateEntry_shouldIgnorePartialSignals() {
        TradeEngine engine = newEngine(new BigDecimal("5"));
        Map<String, BigDecimal> values = bullishValues();
        values.put(IndicatorSnapshot.RSI, new BigDecimal("75"));

        engine.evaluateEntry(IndicatorSnapshot.of(values));

        assertTrue(exchange.placedOrders.isEmpty());
        assertNull(engine.getCooldownUntil());
    }

    @Test
    void evaluateExit_shouldKeepPositionWhenSellFails() {
        TradeEngine engine = newEngine(new BigDecimal("5"));
        exchange.fillNextOrder(new BigDecimal("100"), new BigDecimal("2"));
        engine.evaluateEntry(bullish());

        exchange.placeOrderError = new ExchangeException(ExchangeException.ErrorCode.TIMEOUT, "read timed out");
        engine.evaluateExit(new BigDecimal("99"));

        assertEquals(EngineState.IN_POSITION, engine.getState());
        assertTrue(journal.records.isEmpty());

        exchange.placeOrderError = null;
        engine.evaluateExit(new BigDecimal("99"));

        assertEquals(EngineState.FLAT, engine.getState());
        assertEquals("sl", journal.records.get(0).reason());
    }

    @Test
    void evaluateExit_shouldTimeOutAndFallBackToTriggerPrice() {
        TradeEngine engine = newEngine(new BigDecimal("5"));
        exchange.fillNextOrder(new BigDecimal("100"), new BigDecimal("2"));
        engine.evaluateEntry(bullish());

        clock.advance(Duration.ofMinutes(21));
        engine.evaluateExit(new BigDecimal("100.1"));

        TradeRecord record = journal.records.get(0);
        assertEquals("timeout", record.reason());
        assertEquals(0, new BigDecimal("100.1").compareTo(record.price()));
        assertEquals(0, new BigDecimal("0.2").compareTo(record.pnl()));
    }

    @Test
    void evaluateExit_shouldMeasurePnlOnQuantityActuallySold() {
        TradeEngine engine = newEngine(new BigDecimal("5"));
        exchange.fillNextOrder(new BigDecimal("100"), new BigDecimal("2"));
        engine.evaluateEntry(bullish());

        // 买入手续费以 BTC 扣除，可卖数量少于持仓
        exchange.balances.put("BTC", new BigDecimal("1.9"));
        exchange.fillNextOrder(new BigDecimal("100.5"), new BigDecimal("1.9"));
        engine.evaluateExit(new BigDecimal("100.5"));

        assertEquals(0, new BigDecimal("1.9").compareTo(exchange.lastOrder().getQuantity()));
        TradeRecord record = journal.records.get(0);
        assertEquals(0, new BigDecimal("1.9").compareTo(record.quantity()));
        assertEquals(0, new BigDecimal("190").compareTo(record.investment()));
        assertEquals(0, new BigDecimal("0.95").compareTo(record.pnl()));
    }

    @Test
    void evaluateExit_shouldRecordNullBalanceWhenQueryFails() {
        TradeEngine engine = newEngine(new BigDecimal("5"));
        exchange.fillNextOrder(new BigDecimal("100"), new BigDecimal("2"));
        engine.evaluateEntry(bullish());

        // 卖出前的余额查询成功，之后失败
        exchange.fillNextOrder(new BigDecimal("100.5"), new BigDecimal("2"));
        exchange.balanceError = new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR, "reset");
        exchange.balanceErrorAfterCalls = exchange.balanceCalls + 1;
        engine.evaluateExit(new BigDecimal("100.5"));

        assertEquals(EngineState.FLAT, engine.getState());
        assertNull(journal.records.get(0).balance());
    }

    @Test
    void onTick_shouldBeIgnoredWhileFlat() {
        TradeEngine engine = newEngine(new BigDecimal("5"));

        engine.onTick(new Tick(SYMBOL, new BigDecimal("100"), START));

        assertTrue(exchange.placedOrders.isEmpty());
        assertEquals(0, exchange.tickerCalls);
    }

    @Test
    void onKLine_shouldEvaluateOnlyNewConfirmedCandles() {
        TradeEngine engine = newEngine(new BigDecimal("5"));
        List<KLine> history = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            history.add(kLine(i, BigDecimal.valueOf(100 + i)));
        }
        engine.warmUp(history);
        assertEquals(40, engine.getWindow().size());

        engine.onKLine(kLine(40, new BigDecimal("140")));
        engine.onKLine(kLine(40, new BigDecimal("140")));

        // 单边上涨 RSI 超买，不开仓
        assertEquals(41, engine.getWindow().size());
        assertTrue(exchange.placedOrders.isEmpty());
        assertEquals(EngineState.FLAT, engine.getState());
    }

    private static IndicatorSnapshot bullish() {
        return IndicatorSnapshot.of(bullishValues());
    }

    private static Map<String, BigDecimal> bullishValues() {
        Map<String, BigDecimal> values = new HashMap<>();
        values.put(IndicatorSnapshot.EMA_FAST, new BigDecimal("101"));
        values.put(IndicatorSnapshot.EMA_SLOW, new BigDecimal("100"));
        values.put(IndicatorSnapshot.ADX, new BigDecimal("30"));
        values.put(IndicatorSnapshot.RSI, new BigDecimal("55"));
        values.put(IndicatorSnapshot.VOLUME, new BigDecimal("2"));
        values.put(IndicatorSnapshot.VOLUME_SMA, new BigDecimal("1"));
        return values;
    }

    private static KLine kLine(int minute, BigDecimal close) {
        Instant open = START.minus(Duration.ofHours(2)).plusSeconds(60L * minute);
        return new KLine(SYMBOL, Interval.ONE_MINUTE, open, open.plusSeconds(59),
                close, close.add(new BigDecimal("0.5")), close.subtract(new BigDecimal("0.5")), close,
                BigDecimal.ONE, close, true);
    }

    private static final class RecordingJournal implements TradeJournal {
        final List<TradeRecord> records = new ArrayList<>();

        @Override
        public void record(TradeRecord record) {
            records.add(record);
        }
    }
}
