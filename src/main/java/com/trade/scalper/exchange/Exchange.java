package com.trade.scalper.exchange;

import com.trade.scalper.core.*;

import java.util.Collection;
import java.util.List;

/**
 * 交易所抽象接口
 * 上层只能通过此接口访问交易所，瞬时故障在实现内部重试，其余错误原样抛出
 */
public interface Exchange {

    /**
     * 获取交易所名称
     */
    String getName();

    /**
     * 查询钱包可用余额
     * 按账户类型依次探测，返回第一个成功的账户
     * @param coins 关心的币种，如 USDT、BTC
     */
    WalletBalance getWalletBalance(Collection<String> coins) throws ExchangeException;

    /**
     * 获取实时行情
     */
    Ticker getTicker(Symbol symbol) throws ExchangeException;

    /**
     * 获取交易对下单规则
     */
    SymbolFilters getSymbolFilters(Symbol symbol) throws ExchangeException;

    /**
     * 下单（唯一的写操作，仅在请求确定未发出时重试）
     */
    OrderResult placeOrder(OrderRequest request) throws ExchangeException;

    /**
     * 取消订单，orderId 与 orderLinkId 至少提供一个
     */
    void cancelOrder(Symbol symbol, String orderId, String orderLinkId) throws ExchangeException;

    /**
     * 查询交易对的未完成订单
     */
    List<OpenOrder> getOpenOrders(Symbol symbol) throws ExchangeException;

    /**
     * 查询成交记录
     * @param orderId 为空时返回该交易对最近的成交
     */
    List<Execution> getExecutions(Symbol symbol, String orderId, int limit) throws ExchangeException;

    /**
     * 获取最近的K线，按开盘时间升序
     * @param limit 数量限制（最大1000）
     */
    List<KLine> getKLines(Symbol symbol, Interval interval, int limit) throws ExchangeException;
}
