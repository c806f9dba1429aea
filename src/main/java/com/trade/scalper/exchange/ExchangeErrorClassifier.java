package com.trade.scalper.exchange;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;

/**
 * 将网络异常、HTTP 状态码与 Bybit retCode 归类为 {@link ExchangeException.ErrorCode}
 */
public final class ExchangeErrorClassifier {

    /**
     * Bybit 认证/权限类 retCode
     */
    static final Set<Integer> AUTH_RET_CODES = Set.of(10003, 10004, 10005, 10007, 10009, 10010, 33004);

    static final int RATE_LIMIT_RET_CODE = 10006;

    private ExchangeErrorClassifier() {
    }

    public static ExchangeException fromIOException(String operation, IOException e) {
        ExchangeException.ErrorCode code;
        if (e instanceof ConnectException
                || e instanceof UnknownHostException
                || e instanceof NoRouteToHostException) {
            code = ExchangeException.ErrorCode.CONNECT_FAILED;
        } else if (e instanceof SocketTimeoutException && isConnectTimeout(e)) {
            code = ExchangeException.ErrorCode.CONNECT_FAILED;
        } else if (e instanceof InterruptedIOException) {
            code = ExchangeException.ErrorCode.TIMEOUT;
        } else {
            code = ExchangeException.ErrorCode.NETWORK_ERROR;
        }
        return new ExchangeException(code, operation + " 请求失败: " + summarize(e), e);
    }

    public static ExchangeException fromHttpStatus(String operation, int status, String body) {
        ExchangeException.ErrorCode code;
        if (status == 429) {
            code = ExchangeException.ErrorCode.RATE_LIMIT;
        } else if (status == 401 || status == 403) {
            code = ExchangeException.ErrorCode.AUTH_FAILED;
        } else if (status >= 500) {
            code = ExchangeException.ErrorCode.SERVER_ERROR;
        } else {
            code = ExchangeException.ErrorCode.REJECTED;
        }
        return new ExchangeException(code, operation + " HTTP " + status + ": " + abbreviate(body));
    }

    public static ExchangeException fromRetCode(String operation, int retCode, String retMsg) {
        ExchangeException.ErrorCode code;
        if (AUTH_RET_CODES.contains(retCode)) {
            code = ExchangeException.ErrorCode.AUTH_FAILED;
        } else if (retCode == RATE_LIMIT_RET_CODE) {
            code = ExchangeException.ErrorCode.RATE_LIMIT;
        } else {
            code = ExchangeException.ErrorCode.REJECTED;
        }
        return new ExchangeException(code, retCode,
                operation + " 被交易所拒绝: retCode=" + retCode + ", retMsg=" + retMsg, null);
    }

    /**
     * 异常链摘要，最多三层
     */
    public static String summarize(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        StringBuilder sb = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 3) {
            if (depth > 0) {
                sb.append(" | ");
            }
            String msg = current.getMessage();
            if (msg == null || msg.isBlank()) {
                sb.append(current.getClass().getSimpleName());
            } else {
                sb.append(msg);
            }
            current = current.getCause();
            depth++;
        }
        return sb.toString();
    }

    private static boolean isConnectTimeout(IOException e) {
        String message = e.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("connect timed out");
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
