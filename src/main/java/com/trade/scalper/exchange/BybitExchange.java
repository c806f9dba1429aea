package com.trade.scalper.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.scalper.core.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bybit v5 现货网关
 * 查询类请求按注入的 {@link RetryPolicy} 重试；下单与撤单只重试请求尚未发出时的故障。
 */
public class BybitExchange implements Exchange {

    private static final Logger logger = LoggerFactory.getLogger(BybitExchange.class);

    private static final String WALLET_BALANCE_PATH = "/v5/account/wallet-balance";
    private static final String TICKERS_PATH = "/v5/market/tickers";
    private static final String INSTRUMENTS_PATH = "/v5/market/instruments-info";
    private static final String KLINE_PATH = "/v5/market/kline";
    private static final String ORDER_CREATE_PATH = "/v5/order/create";
    private static final String ORDER_CANCEL_PATH = "/v5/order/cancel";
    private static final String EXECUTION_LIST_PATH = "/v5/execution/list";
    private static final String OPEN_ORDERS_PATH = "/v5/order/realtime";
    private static final int MAX_KLINE_LIMIT = 1000;
    private static final int MAX_EXECUTION_LIMIT = 100;

    private final RestTransport transport;
    private final ObjectMapper objectMapper;
    private final RetryPolicy readPolicy;
    private final RetryPolicy orderPolicy;
    private final AccountType preferredAccountType;
    private final String category;
    private final Clock clock;

    public BybitExchange(RestTransport transport, ObjectMapper objectMapper, RetryPolicy retryPolicy,
                         AccountType preferredAccountType, String category, Clock clock) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.readPolicy = retryPolicy;
        this.orderPolicy = retryPolicy.withRetryable(ExchangeException::isPreSubmission);
        this.preferredAccountType = preferredAccountType;
        this.category = category;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "Bybit";
    }

    @Override
    public WalletBalance getWalletBalance(Collection<String> coins) throws ExchangeException {
        ExchangeException last = null;
        for (AccountType accountType : AccountType.probeOrder(preferredAccountType)) {
            try {
                WalletBalance balance = readPolicy.execute("查询余额[" + accountType + "]",
                        () -> fetchWalletBalance(accountType, coins));
                if (accountType != preferredAccountType) {
                    logger.info("账户类型 {} 不可用，已改用 {}", preferredAccountType, accountType);
                }
                return balance;
            } catch (ExchangeException e) {
                // 瞬时故障耗尽重试后直接抛出，认证失败与拒绝改试下一账户类型
                if (e.isTransient()) {
                    throw e;
                }
                logger.warn("账户类型 {} 查询余额失败 [{}]: {}", accountType, e.getErrorCode(), e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    private WalletBalance fetchWalletBalance(AccountType accountType, Collection<String> coins)
            throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("accountType", accountType.name());
        if (coins != null && !coins.isEmpty()) {
            query.put("coin", String.join(",", coins));
        }
        JsonNode result = callResult("查询余额", transport.get(WALLET_BALANCE_PATH, query, true));
        Map<String, BigDecimal> available = new LinkedHashMap<>();
        JsonNode accounts = result.path("list");
        if (accounts.isArray() && !accounts.isEmpty()) {
            for (JsonNode coin : accounts.get(0).path("coin")) {
                String asset = coin.path("coin").asText("");
                if (asset.isBlank()) {
                    continue;
                }
                BigDecimal wallet = optionalDecimal(coin, "walletBalance", BigDecimal.ZERO);
                BigDecimal locked = optionalDecimal(coin, "locked", BigDecimal.ZERO);
                available.put(asset, Decimal.max(wallet.subtract(locked), BigDecimal.ZERO));
            }
        }
        return new WalletBalance(accountType, available);
    }

    @Override
    public Ticker getTicker(Symbol symbol) throws ExchangeException {
        return readPolicy.execute("查询行情", () -> {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("category", category);
            query.put("symbol", symbol.toPairString());
            JsonNode result = callResult("查询行情", transport.get(TICKERS_PATH, query, false));
            JsonNode row = firstRow(result, symbol, "查询行情");
            BigDecimal last = requiredDecimal(row, "lastPrice", "查询行情");
            return new Ticker(symbol,
                    optionalDecimal(row, "bid1Price", null),
                    optionalDecimal(row, "ask1Price", null),
                    last,
                    clock.instant());
        });
    }

    @Override
    public SymbolFilters getSymbolFilters(Symbol symbol) throws ExchangeException {
        return readPolicy.execute("查询交易规则", () -> {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("category", category);
            query.put("symbol", symbol.toPairString());
            JsonNode result = callResult("查询交易规则", transport.get(INSTRUMENTS_PATH, query, false));
            JsonNode row = firstRow(result, symbol, "查询交易规则");
            JsonNode lot = row.path("lotSizeFilter");
            JsonNode price = row.path("priceFilter");

            BigDecimal basePrecision = optionalDecimal(lot, "basePrecision", null);
            // 现货没有 qtyStep，以 basePrecision 为数量步长
            BigDecimal qtyStep = optionalDecimal(lot, "qtyStep", basePrecision);
            if (qtyStep == null) {
                throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN,
                        "交易规则缺少数量步长: " + symbol);
            }
            BigDecimal minNotional = optionalDecimal(lot, "minOrderAmt",
                    optionalDecimal(lot, "minNotionalValue", BigDecimal.ZERO));

            SymbolFilters filters = new SymbolFilters(
                    symbol,
                    qtyStep,
                    optionalDecimal(lot, "minOrderQty", BigDecimal.ZERO),
                    optionalDecimal(lot, "maxOrderQty", null),
                    basePrecision,
                    optionalDecimal(lot, "quotePrecision", null),
                    requiredDecimal(price, "tickSize", "查询交易规则"),
                    optionalDecimal(price, "minPrice", null),
                    optionalDecimal(price, "maxPrice", null),
                    minNotional
            );
            logger.info("交易规则已加载: {}", filters);
            return filters;
        });
    }

    @Override
    public OrderResult placeOrder(OrderRequest request) throws ExchangeException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", category);
        body.put("symbol", request.getSymbol().toPairString());
        body.put("side", request.getSide().getExchangeCode());
        body.put("orderType", request.getType().getExchangeCode());
        body.put("qty", request.getQuantity().toPlainString());
        if (request.getMarketUnit() != null) {
            body.put("marketUnit", request.getMarketUnit().getExchangeCode());
        }
        if (request.getPrice() != null) {
            body.put("price", request.getPrice().toPlainString());
        }
        if (request.getTriggerPrice() != null) {
            body.put("triggerPrice", request.getTriggerPrice().toPlainString());
        }
        if (request.getOrderFilter() == OrderFilter.TPSL_ORDER) {
            body.put("orderFilter", request.getOrderFilter().getExchangeCode());
        }
        body.put("timeInForce", request.getTimeInForce().name());
        if (request.getOrderLinkId() != null) {
            body.put("orderLinkId", request.getOrderLinkId());
        }

        logger.info("提交订单: {}", body);
        return orderPolicy.execute("下单", () -> {
            JsonNode result = callResult("下单", transport.post(ORDER_CREATE_PATH, body));
            String orderId = result.path("orderId").asText("");
            if (orderId.isBlank()) {
                throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN, "下单响应缺少 orderId");
            }
            return new OrderResult(orderId, result.path("orderLinkId").asText(request.getOrderLinkId()));
        });
    }

    @Override
    public void cancelOrder(Symbol symbol, String orderId, String orderLinkId) throws ExchangeException {
        if ((orderId == null || orderId.isBlank()) && (orderLinkId == null || orderLinkId.isBlank())) {
            throw new IllegalArgumentException("orderId 与 orderLinkId 至少提供一个");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", category);
        body.put("symbol", symbol.toPairString());
        if (orderId != null && !orderId.isBlank()) {
            body.put("orderId", orderId);
        } else {
            body.put("orderLinkId", orderLinkId);
        }
        orderPolicy.execute("撤单", () -> callResult("撤单", transport.post(ORDER_CANCEL_PATH, body)));
    }

    @Override
    public List<OpenOrder> getOpenOrders(Symbol symbol) throws ExchangeException {
        return readPolicy.execute("查询挂单", () -> {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("category", category);
            query.put("symbol", symbol.toPairString());
            JsonNode result = callResult("查询挂单", transport.get(OPEN_ORDERS_PATH, query, true));
            List<OpenOrder> orders = new ArrayList<>();
            for (JsonNode row : result.path("list")) {
                try {
                    orders.add(new OpenOrder(
                            row.path("orderId").asText(""),
                            row.path("orderLinkId").asText(""),
                            Side.fromExchangeCode(row.path("side").asText("")),
                            OrderType.fromExchangeCode(row.path("orderType").asText("")),
                            optionalDecimal(row, "price", BigDecimal.ZERO),
                            requiredDecimal(row, "qty", "查询挂单"),
                            optionalDecimal(row, "cumExecQty", BigDecimal.ZERO),
                            optionalDecimal(row, "triggerPrice", BigDecimal.ZERO),
                            row.path("orderStatus").asText("")));
                } catch (IllegalArgumentException e) {
                    throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN,
                            "查询挂单返回无法识别的订单: " + row, e);
                }
            }
            return orders;
        });
    }

    @Override
    public List<Execution> getExecutions(Symbol symbol, String orderId, int limit) throws ExchangeException {
        return readPolicy.execute("查询成交", () -> {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("category", category);
            query.put("symbol", symbol.toPairString());
            if (orderId != null && !orderId.isBlank()) {
                query.put("orderId", orderId);
            }
            query.put("limit", Integer.toString(Math.max(1, Math.min(limit, MAX_EXECUTION_LIMIT))));
            JsonNode result = callResult("查询成交", transport.get(EXECUTION_LIST_PATH, query, true));
            List<Execution> executions = new ArrayList<>();
            for (JsonNode row : result.path("list")) {
                executions.add(new Execution(
                        row.path("orderId").asText(""),
                        row.path("execId").asText(""),
                        requiredDecimal(row, "execPrice", "查询成交"),
                        requiredDecimal(row, "execQty", "查询成交"),
                        optionalDecimal(row, "execFee", BigDecimal.ZERO),
                        Instant.ofEpochMilli(row.path("execTime").asLong(0L))
                ));
            }
            return executions;
        });
    }

    @Override
    public List<KLine> getKLines(Symbol symbol, Interval interval, int limit) throws ExchangeException {
        return readPolicy.execute("查询K线", () -> {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("category", category);
            query.put("symbol", symbol.toPairString());
            query.put("interval", interval.getExchangeCode());
            query.put("limit", Integer.toString(Math.max(1, Math.min(limit, MAX_KLINE_LIMIT))));
            JsonNode result = callResult("查询K线", transport.get(KLINE_PATH, query, false));
            Instant now = clock.instant();
            List<KLine> kLines = new ArrayList<>();
            for (JsonNode row : result.path("list")) {
                if (!row.isArray() || row.size() < 6) {
                    continue;
                }
                Instant openTime = Instant.ofEpochMilli(row.get(0).asLong());
                Instant nextOpen = openTime.plus(interval.getDuration());
                kLines.add(new KLine(
                        symbol,
                        interval,
                        openTime,
                        nextOpen.minusMillis(1),
                        new BigDecimal(row.get(1).asText()),
                        new BigDecimal(row.get(2).asText()),
                        new BigDecimal(row.get(3).asText()),
                        new BigDecimal(row.get(4).asText()),
                        new BigDecimal(row.get(5).asText()),
                        row.size() > 6 ? new BigDecimal(row.get(6).asText()) : BigDecimal.ZERO,
                        !nextOpen.isAfter(now)
                ));
            }
            // 交易所按时间倒序返回
            Collections.reverse(kLines);
            return kLines;
        });
    }

    /**
     * 解析响应并检查 retCode，返回 result 节点
     */
    private JsonNode callResult(String operation, String body) throws ExchangeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN, operation + " 响应不是合法 JSON", e);
        }
        if (root == null || !root.has("retCode")) {
            throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN, operation + " 响应缺少 retCode");
        }
        int retCode = root.path("retCode").asInt(-1);
        if (retCode != 0) {
            throw ExchangeErrorClassifier.fromRetCode(operation, retCode, root.path("retMsg").asText(""));
        }
        return root.path("result");
    }

    private JsonNode firstRow(JsonNode result, Symbol symbol, String operation) throws ExchangeException {
        JsonNode list = result.path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.INVALID_SYMBOL,
                    operation + " 返回为空: " + symbol);
        }
        return list.get(0);
    }

    private BigDecimal requiredDecimal(JsonNode node, String field, String operation) throws ExchangeException {
        String raw = node.path(field).asText("");
        if (raw.isBlank()) {
            throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN, operation + " 响应缺少字段 " + field);
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN,
                    operation + " 字段 " + field + " 不是数值: " + raw, e);
        }
    }

    private BigDecimal optionalDecimal(JsonNode node, String field, BigDecimal fallback) {
        String raw = node.path(field).asText("");
        if (raw.isBlank()) {
            return fallback;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("字段 {} 不是数值: {}", field, raw);
            return fallback;
        }
    }
}
