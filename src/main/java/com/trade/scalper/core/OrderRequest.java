package com.trade.scalper.core;

import java.math.BigDecimal;

/**
 * 下单请求
 * 数量与价格在构造前已按交易规则规范化，发送时原样输出定点字符串
 */
public class OrderRequest {
    private final Symbol symbol;
    private final Side side;
    private final OrderType type;
    private final BigDecimal quantity;
    private final MarketUnit marketUnit;     // 为空时不发送
    private final BigDecimal price;          // 仅限价单
    private final BigDecimal triggerPrice;   // 仅条件单
    private final TimeInForce timeInForce;
    private final OrderFilter orderFilter;
    private final String orderLinkId;

    private OrderRequest(Builder builder) {
        this.symbol = builder.symbol;
        this.side = builder.side;
        this.type = builder.type;
        this.quantity = builder.quantity;
        this.marketUnit = builder.marketUnit;
        this.price = builder.price;
        this.triggerPrice = builder.triggerPrice;
        this.timeInForce = builder.timeInForce;
        this.orderFilter = builder.orderFilter;
        this.orderLinkId = builder.orderLinkId;
    }

    public Symbol getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public OrderType getType() { return type; }
    public BigDecimal getQuantity() { return quantity; }
    public MarketUnit getMarketUnit() { return marketUnit; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getTriggerPrice() { return triggerPrice; }
    public TimeInForce getTimeInForce() { return timeInForce; }
    public OrderFilter getOrderFilter() { return orderFilter; }
    public String getOrderLinkId() { return orderLinkId; }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("OrderRequest{%s %s %s qty=%s unit=%s price=%s trigger=%s tif=%s filter=%s}",
                symbol, side, type, quantity.toPlainString(), marketUnit,
                price == null ? "-" : price.toPlainString(),
                triggerPrice == null ? "-" : triggerPrice.toPlainString(),
                timeInForce, orderFilter);
    }

    public static class Builder {
        private Symbol symbol;
        private Side side;
        private OrderType type = OrderType.MARKET;
        private BigDecimal quantity;
        private MarketUnit marketUnit;
        private BigDecimal price;
        private BigDecimal triggerPrice;
        private TimeInForce timeInForce = TimeInForce.IOC;
        private OrderFilter orderFilter = OrderFilter.ORDER;
        private String orderLinkId;

        public Builder symbol(Symbol symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder type(OrderType type) {
            this.type = type;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder marketUnit(MarketUnit marketUnit) {
            this.marketUnit = marketUnit;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder triggerPrice(BigDecimal triggerPrice) {
            this.triggerPrice = triggerPrice;
            return this;
        }

        public Builder timeInForce(TimeInForce timeInForce) {
            this.timeInForce = timeInForce;
            return this;
        }

        public Builder orderFilter(OrderFilter orderFilter) {
            this.orderFilter = orderFilter;
            return this;
        }

        public Builder orderLinkId(String orderLinkId) {
            this.orderLinkId = orderLinkId;
            return this;
        }

        public OrderRequest build() {
            if (symbol == null || side == null || type == null) {
                throw new IllegalStateException("交易对、方向、类型不能为空");
            }
            if (quantity == null || quantity.signum() <= 0) {
                throw new IllegalStateException("下单数量必须大于0");
            }
            if (type == OrderType.LIMIT && price == null) {
                throw new IllegalStateException("限价单必须指定价格");
            }
            if (orderFilter == OrderFilter.TPSL_ORDER && triggerPrice == null) {
                throw new IllegalStateException("条件单必须指定触发价");
            }
            return new OrderRequest(this);
        }
    }
}
