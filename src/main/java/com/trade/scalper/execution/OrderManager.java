package com.trade.scalper.execution;

import com.trade.scalper.core.*;
import com.trade.scalper.exchange.Exchange;
import com.trade.scalper.exchange.ExchangeException;
import com.trade.scalper.exchange.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * 订单管理器
 * 规范化数量/价格后向交易所下单，每个操作只有一次下单调用。
 * 交易规则在进程内缓存，只能通过 {@link #refreshFilters()} 主动刷新；余额每次实时查询。
 */
public class OrderManager {

    private static final Logger logger = LoggerFactory.getLogger(OrderManager.class);

    private static final int FILL_QUERY_LIMIT = 50;

    private final Exchange exchange;
    private final Symbol symbol;
    private final boolean marketUnitSupported;
    private final BigDecimal quoteBuffer;
    private final int fillPollAttempts;
    private final Duration fillPollDelay;
    private final RetryPolicy.Sleeper sleeper;

    private volatile SymbolFilters filters;

    public OrderManager(Exchange exchange, Symbol symbol, boolean marketUnitSupported, BigDecimal quoteBuffer,
                        int fillPollAttempts, Duration fillPollDelay, RetryPolicy.Sleeper sleeper) {
        this.exchange = exchange;
        this.symbol = symbol;
        this.marketUnitSupported = marketUnitSupported;
        this.quoteBuffer = quoteBuffer;
        this.fillPollAttempts = Math.max(1, fillPollAttempts);
        this.fillPollDelay = fillPollDelay;
        this.sleeper = sleeper;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    /**
     * 交易规则，首次使用时加载
     */
    public SymbolFilters filters() throws ExecutionException {
        SymbolFilters current = filters;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (filters == null) {
                filters = loadFilters();
            }
            return filters;
        }
    }

    /**
     * 重新加载交易规则
     */
    public synchronized SymbolFilters refreshFilters() throws ExecutionException {
        filters = loadFilters();
        return filters;
    }

    private SymbolFilters loadFilters() throws ExecutionException {
        try {
            return exchange.getSymbolFilters(symbol);
        } catch (ExchangeException e) {
            throw new ExecutionException("获取交易规则失败: " + symbol + " [" + e.getErrorCode() + "]", e);
        }
    }

    /**
     * 最小下单金额（报价货币）
     */
    public BigDecimal minOrderValue() throws ExecutionException {
        return filters().getMinNotional();
    }

    /**
     * 实时查询某币种可用余额
     */
    public BigDecimal availableBalance(String asset) throws ExecutionException {
        try {
            return exchange.getWalletBalance(List.of(asset)).getAvailable(asset);
        } catch (ExchangeException e) {
            throw new ExecutionException("查询余额失败: " + asset + " [" + e.getErrorCode() + "]", e);
        }
    }

    /**
     * 按报价货币金额市价买入
     * 不预先检查余额，余额不足由交易所拒单
     */
    public OrderResult marketBuyQuote(BigDecimal quoteAmount) throws ExecutionException {
        SymbolFilters f = filters();
        BigDecimal amount = OrderNormalizer.quoteAmount(quoteAmount, f, quoteBuffer);
        OrderRequest request = OrderRequest.builder()
                .symbol(symbol)
                .side(Side.BUY)
                .type(OrderType.MARKET)
                .quantity(amount)
                .marketUnit(marketUnitSupported ? MarketUnit.QUOTE : null)
                .timeInForce(TimeInForce.IOC)
                .orderLinkId(newOrderLinkId())
                .build();
        return submit(request);
    }

    /**
     * 按基础货币数量市价买入
     */
    public OrderResult marketBuyBase(BigDecimal quantity) throws ExecutionException {
        SymbolFilters f = filters();
        BigDecimal qty = OrderNormalizer.buyQuantity(quantity, currentPrice(), f);
        OrderRequest request = OrderRequest.builder()
                .symbol(symbol)
                .side(Side.BUY)
                .type(OrderType.MARKET)
                .quantity(qty)
                .marketUnit(marketUnitSupported ? MarketUnit.BASE : null)
                .timeInForce(TimeInForce.IOC)
                .orderLinkId(newOrderLinkId())
                .build();
        return submit(request);
    }

    /**
     * 按基础货币数量市价卖出，数量不超过实时可用余额
     */
    public OrderResult marketSellBase(BigDecimal quantity) throws ExecutionException {
        SymbolFilters f = filters();
        BigDecimal available = availableBalance(symbol.getBase());
        BigDecimal qty = OrderNormalizer.sellQuantity(quantity, available, currentPrice(), f);
        if (qty.compareTo(quantity) < 0) {
            logger.info("{} 卖出数量由 {} 调整为 {}（可用 {}）",
                    symbol, quantity.toPlainString(), qty.toPlainString(), available.toPlainString());
        }
        OrderRequest request = OrderRequest.builder()
                .symbol(symbol)
                .side(Side.SELL)
                .type(OrderType.MARKET)
                .quantity(qty)
                .marketUnit(marketUnitSupported ? MarketUnit.BASE : null)
                .timeInForce(TimeInForce.IOC)
                .orderLinkId(newOrderLinkId())
                .build();
        return submit(request);
    }

    /**
     * 限价单
     */
    public OrderResult limitOrder(Side side, BigDecimal quantity, BigDecimal price) throws ExecutionException {
        SymbolFilters f = filters();
        BigDecimal limitPrice = OrderNormalizer.roundPrice(price, f);
        BigDecimal qty = side == Side.BUY
                ? OrderNormalizer.buyQuantity(quantity, limitPrice, f)
                : OrderNormalizer.sellQuantity(quantity, availableBalance(symbol.getBase()), limitPrice, f);
        OrderRequest request = OrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .type(OrderType.LIMIT)
                .quantity(qty)
                .price(limitPrice)
                .timeInForce(TimeInForce.GTC)
                .orderLinkId(newOrderLinkId())
                .build();
        return submit(request);
    }

    /**
     * 现货条件单：价格触及触发价后以市价成交
     */
    public OrderResult conditionalOrder(Side side, BigDecimal quantity, BigDecimal triggerPrice)
            throws ExecutionException {
        SymbolFilters f = filters();
        BigDecimal trigger = OrderNormalizer.roundPrice(triggerPrice, f);
        BigDecimal qty = side == Side.BUY
                ? OrderNormalizer.buyQuantity(quantity, trigger, f)
                : OrderNormalizer.sellQuantity(quantity, availableBalance(symbol.getBase()), trigger, f);
        OrderRequest request = OrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .type(OrderType.MARKET)
                .quantity(qty)
                .marketUnit(marketUnitSupported ? MarketUnit.BASE : null)
                .triggerPrice(trigger)
                .orderFilter(OrderFilter.TPSL_ORDER)
                .timeInForce(TimeInForce.GTC)
                .orderLinkId(newOrderLinkId())
                .build();
        return submit(request);
    }

    /**
     * 按交易所订单号撤单
     */
    public void cancel(String orderId) throws ExecutionException {
        cancel(orderId, null);
    }

    /**
     * 按客户端订单号撤单
     */
    public void cancelByLinkId(String orderLinkId) throws ExecutionException {
        cancel(null, orderLinkId);
    }

    private void cancel(String orderId, String orderLinkId) throws ExecutionException {
        String ref = orderId != null ? "orderId=" + orderId : "orderLinkId=" + orderLinkId;
        try {
            exchange.cancelOrder(symbol, orderId, orderLinkId);
            logger.info("{} 订单已撤销: {}", symbol, ref);
        } catch (ExchangeException e) {
            logger.error("{} 撤单失败 {} [{}] code={}: {}",
                    symbol, ref, e.getErrorCode(), e.getExchangeCode(), e.getMessage());
            throw new ExecutionException("撤单失败: " + ref, e);
        }
    }

    /**
     * 当前交易对的未完成订单
     */
    public List<OpenOrder> openOrders() throws ExecutionException {
        try {
            return exchange.getOpenOrders(symbol);
        } catch (ExchangeException e) {
            throw new ExecutionException("查询挂单失败: " + symbol + " [" + e.getErrorCode() + "]", e);
        }
    }

    /**
     * 查询订单的累计成交，未查到时按间隔重试若干次
     * 查询本身失败时返回空成交，不抛异常
     */
    public Fill lastFill(String orderId) {
        for (int attempt = 1; attempt <= fillPollAttempts; attempt++) {
            try {
                Fill fill = Fill.aggregate(orderId, exchange.getExecutions(symbol, orderId, FILL_QUERY_LIMIT));
                if (fill.isFilled()) {
                    return fill;
                }
            } catch (ExchangeException e) {
                logger.warn("{} 查询成交失败 orderId={} [{}]: {}", symbol, orderId, e.getErrorCode(), e.getMessage());
                return Fill.empty(orderId);
            }
            if (attempt < fillPollAttempts) {
                try {
                    sleeper.sleep(fillPollDelay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.warn("{} 订单 {} 未查询到成交", symbol, orderId);
        return Fill.empty(orderId);
    }

    private BigDecimal currentPrice() throws ExecutionException {
        try {
            return exchange.getTicker(symbol).getLastPrice();
        } catch (ExchangeException e) {
            throw new ExecutionException("获取最新价失败，订单未发送 [" + e.getErrorCode() + "]", e);
        }
    }

    private OrderResult submit(OrderRequest request) throws ExecutionException {
        try {
            OrderResult result = exchange.placeOrder(request);
            logger.info("订单已提交: {} -> orderId={}", request, result.orderId());
            return result;
        } catch (ExchangeException e) {
            logger.error("下单失败 {} {} qty={} price={} trigger={} [{}] code={}: {}",
                    request.getSymbol(), request.getSide(), request.getQuantity().toPlainString(),
                    request.getPrice() == null ? "-" : request.getPrice().toPlainString(),
                    request.getTriggerPrice() == null ? "-" : request.getTriggerPrice().toPlainString(),
                    e.getErrorCode(), e.getExchangeCode(), e.getMessage());
            throw new ExecutionException("下单失败: " + e.getMessage(), e);
        }
    }

    private String newOrderLinkId() {
        return "scalp-" + UUID.randomUUID().toString().replace("-", "").substring(0, 20);
    }
}
