package com.trade.scalper.exchange;

import java.util.Map;

/**
 * REST 传输层
 * 返回 HTTP 200 的原始响应体；连接失败、超时与非 2xx 状态转换为 {@link ExchangeException}
 */
public interface RestTransport {

    /**
     * GET 请求
     * @param signed 是否需要签名（私有接口）
     */
    String get(String path, Map<String, String> query, boolean signed) throws ExchangeException;

    /**
     * 签名 POST 请求，body 序列化为 JSON
     */
    String post(String path, Map<String, Object> body) throws ExchangeException;
}
