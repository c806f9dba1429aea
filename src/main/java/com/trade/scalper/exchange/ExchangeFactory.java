package com.trade.scalper.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.scalper.core.AccountType;
import com.trade.scalper.core.TradingEnvironment;
import okhttp3.OkHttpClient;

import java.time.Clock;
import java.time.Duration;

/**
 * 交易所工厂
 */
public final class ExchangeFactory {

    private ExchangeFactory() {}

    /**
     * 共享的 HTTP 客户端，REST 与 WebSocket 共用连接池
     */
    public static OkHttpClient createHttpClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    /**
     * 创建 Bybit 现货网关
     */
    public static Exchange createBybit(OkHttpClient httpClient,
                                       ObjectMapper objectMapper,
                                       TradingEnvironment environment,
                                       String apiKey,
                                       String apiSecret,
                                       long recvWindowMs,
                                       AccountType accountType,
                                       String category) {
        RestTransport transport = new OkHttpRestTransport(
                httpClient, objectMapper, environment.getRestBaseUrl(), apiKey, apiSecret, recvWindowMs);
        return new BybitExchange(transport, objectMapper, RetryPolicy.defaults(),
                accountType, category, Clock.systemUTC());
    }
}
