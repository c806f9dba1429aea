package com.trade.scalper.execution;

import com.trade.scalper.core.*;
import com.trade.scalper.indicator.IndicatorSnapshot;
import com.trade.scalper.indicator.KLineIndicatorCalculator;
import com.trade.scalper.market.KLineWindow;
import com.trade.scalper.market.MarketDataListener;
import com.trade.scalper.strategy.EngineState;
import com.trade.scalper.strategy.EntryDecision;
import com.trade.scalper.strategy.ExitReason;
import com.trade.scalper.strategy.ScalpingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 交易引擎
 *
 * 单一交易对的状态机：FLAT → IN_POSITION → FLAT。
 * 已确认K线驱动开仓判断，K线与最新价都驱动平仓判断。
 * 回调由行情源串行调用，引擎内部不再加锁。
 */
public class TradeEngine implements MarketDataListener {

    private static final Logger logger = LoggerFactory.getLogger(TradeEngine.class);

    private final Symbol symbol;
    private final ScalpingStrategy strategy;
    private final OrderManager orderManager;
    private final TradeJournal journal;
    private final KLineIndicatorCalculator calculator;
    private final KLineWindow window;
    private final Clock clock;

    private volatile EngineState state = EngineState.FLAT;
    private volatile Position position;
    private volatile Instant cooldownUntil;

    public TradeEngine(Symbol symbol, ScalpingStrategy strategy, OrderManager orderManager,
                       TradeJournal journal, KLineIndicatorCalculator calculator,
                       KLineWindow window, Clock clock) {
        this.symbol = symbol;
        this.strategy = strategy;
        this.orderManager = orderManager;
        this.journal = journal;
        this.calculator = calculator;
        this.window = window;
        this.clock = clock;
    }

    /**
     * 用历史K线预热窗口，不触发交易
     */
    public void warmUp(List<KLine> history) {
        int accepted = 0;
        for (KLine kLine : history) {
            if (window.add(kLine)) {
                accepted++;
            }
        }
        KLine last = window.last();
        logger.info("{} 预热完成，载入 {} 根K线，窗口共 {} 根，最新开盘时间 {}", symbol, accepted, window.size(),
                last == null ? "-" : last.getOpenTime());
    }

    @Override
    public void onKLine(KLine kLine) {
        if (!window.add(kLine)) {
            return;
        }
        IndicatorSnapshot indicators = calculator.calculate(window.snapshot());
        if (state == EngineState.FLAT) {
            evaluateEntry(indicators);
        } else {
            evaluateExit(kLine.getClose());
        }
    }

    @Override
    public void onTick(Tick tick) {
        if (state == EngineState.IN_POSITION) {
            evaluateExit(tick.getPrice());
        }
    }

    @Override
    public void onError(Throwable throwable) {
        logger.warn("{} 行情异常: {}", symbol, throwable.getMessage());
    }

    /**
     * 空仓时按指标判断是否开仓
     */
    void evaluateEntry(IndicatorSnapshot indicators) {
        if (state != EngineState.FLAT) {
            return;
        }
        Instant now = clock.instant();
        if (cooldownUntil != null && now.isBefore(cooldownUntil)) {
            logger.debug("{} 冷却中，至 {}", symbol, cooldownUntil);
            return;
        }

        EntryDecision decision = strategy.evaluateEntry(indicators);
        if (!decision.enter()) {
            if (decision.isPartialMatch()) {
                logger.info("{} EMA 多头排列但未开仓，原因: {}", symbol, decision.reason().getCode());
            }
            return;
        }

        BigDecimal spend = strategy.getConfig().getRiskPerTrade();
        try {
            BigDecimal minOrderValue = orderManager.minOrderValue();
            if (spend.compareTo(minOrderValue) < 0) {
                logger.warn("{} 每笔投入 {} 低于最小下单金额 {}，跳过开仓",
                        symbol, spend.toPlainString(), minOrderValue.toPlainString());
                return;
            }

            OrderResult order = orderManager.marketBuyQuote(spend);
            Fill fill = orderManager.lastFill(order.orderId());
            if (!fill.isFilled()) {
                logger.warn("{} 买单 {} 无成交，开仓失败", symbol, order.orderId());
                startCooldown(now);
                return;
            }

            BigDecimal stopLoss = strategy.stopLossPrice(fill.getAveragePrice(), indicators);
            position = new Position(symbol, fill.getAveragePrice(), fill.getQuantity(), clock.instant(), stopLoss);
            state = EngineState.IN_POSITION;
            logger.info("{} 开仓成功: {}，止盈价 {}", symbol, position,
                    strategy.takeProfitPrice(position.getEntryPrice()).toPlainString());
        } catch (ExecutionException e) {
            logger.error("{} 开仓失败: {}", symbol, e.getMessage());
            startCooldown(now);
        }
    }

    /**
     * 持仓时按给定价格判断是否平仓
     */
    void evaluateExit(BigDecimal price) {
        Position current = position;
        if (state != EngineState.IN_POSITION || current == null) {
            return;
        }
        Optional<ExitReason> exit = strategy.evaluateExit(current, price, clock.instant());
        if (exit.isEmpty()) {
            return;
        }
        ExitReason reason = exit.get();
        logger.info("{} 触发平仓 [{}]，价格 {}", symbol, reason.getCode(), price.toPlainString());

        try {
            OrderResult order = orderManager.marketSellBase(current.getQuantity());
            Fill fill = orderManager.lastFill(order.orderId());
            BigDecimal exitPrice = fill.isFilled() ? fill.getAveragePrice() : price;
            BigDecimal soldQuantity = fill.isFilled() ? fill.getQuantity() : current.getQuantity();
            // 投入与盈亏都按实际卖出数量计
            BigDecimal pnl = current.pnlAt(exitPrice, soldQuantity);

            journal.record(new TradeRecord(clock.instant(), symbol, Side.SELL, reason.getCode(),
                    exitPrice, soldQuantity, current.investmentFor(soldQuantity), pnl, balanceAfterExit()));

            position = null;
            state = EngineState.FLAT;
            logger.info("{} 平仓完成 [{}]: 开仓 {} 平仓 {} 数量 {} 盈亏 {}", symbol, reason.getCode(),
                    current.getEntryPrice().toPlainString(), exitPrice.toPlainString(),
                    soldQuantity.toPlainString(), pnl.toPlainString());
        } catch (ExecutionException e) {
            logger.error("{} 平仓失败，保持持仓等待下次检查: {}", symbol, e.getMessage());
        }
    }

    private BigDecimal balanceAfterExit() {
        try {
            return orderManager.availableBalance(symbol.getQuote());
        } catch (ExecutionException e) {
            logger.warn("{} 平仓后查询余额失败: {}", symbol, e.getMessage());
            return null;
        }
    }

    private void startCooldown(Instant from) {
        cooldownUntil = from.plus(strategy.getConfig().getEntryCooldown());
        logger.info("{} 开仓冷却至 {}", symbol, cooldownUntil);
    }

    public EngineState getState() {
        return state;
    }

    public Position getPosition() {
        return position;
    }

    public Instant getCooldownUntil() {
        return cooldownUntil;
    }

    public KLineWindow getWindow() {
        return window;
    }
}
