package com.trade.scalper.exchange;

/**
 * 交易所异常
 */
public class ExchangeException extends Exception {

    private final ErrorCode errorCode;
    private final Integer exchangeCode;   // Bybit retCode，可空

    public ExchangeException(ErrorCode errorCode, String message) {
        this(errorCode, null, message, null);
    }

    public ExchangeException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, null, message, cause);
    }

    public ExchangeException(ErrorCode errorCode, Integer exchangeCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.exchangeCode = exchangeCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Integer getExchangeCode() {
        return exchangeCode;
    }

    /**
     * 网络/超时/服务端类故障，可由重试策略处理
     */
    public boolean isTransient() {
        return errorCode.transientFailure;
    }

    /**
     * 请求确定未离开客户端（建立连接失败），重发不会造成重复下单
     */
    public boolean isPreSubmission() {
        return errorCode == ErrorCode.CONNECT_FAILED;
    }

    public enum ErrorCode {
        NETWORK_ERROR(true),      // 网络错误（请求可能已发出）
        CONNECT_FAILED(true),     // 连接失败（请求未发出）
        TIMEOUT(true),            // 超时
        SERVER_ERROR(true),       // HTTP 5xx
        RATE_LIMIT(true),         // 频率限制（HTTP 429 / 10006）
        REJECTED(false),          // 交易所拒绝（retCode != 0）
        AUTH_FAILED(false),       // 认证失败
        INVALID_SYMBOL(false),    // 无效交易对
        UNKNOWN(false);           // 未知错误

        private final boolean transientFailure;

        ErrorCode(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }
    }
}
