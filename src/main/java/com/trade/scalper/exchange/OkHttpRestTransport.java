package com.trade.scalper.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.LongSupplier;

/**
 * 基于 OkHttp 的 Bybit v5 REST 传输
 * 私有请求带 X-BAPI-* 头，签名为 timestamp + apiKey + recvWindow + (查询串 | JSON 请求体)
 * 的 HMAC-SHA256 十六进制摘要。
 */
public class OkHttpRestTransport implements RestTransport {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String apiSecret;
    private final long recvWindowMs;
    private final LongSupplier clock;

    public OkHttpRestTransport(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                               String apiKey, String apiSecret, long recvWindowMs) {
        this(httpClient, objectMapper, baseUrl, apiKey, apiSecret, recvWindowMs, System::currentTimeMillis);
    }

    OkHttpRestTransport(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                        String apiKey, String apiSecret, long recvWindowMs, LongSupplier clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.recvWindowMs = recvWindowMs;
        this.clock = clock;
    }

    @Override
    public String get(String path, Map<String, String> query, boolean signed) throws ExchangeException {
        String queryString = buildQueryString(query);
        String url = baseUrl + path + (queryString.isEmpty() ? "" : "?" + queryString);
        Request.Builder builder = new Request.Builder().url(url).get();
        if (signed) {
            addAuthHeaders(builder, queryString);
        }
        return execute("GET " + path, builder.build());
    }

    @Override
    public String post(String path, Map<String, Object> body) throws ExchangeException {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN, "请求体序列化失败: " + path, e);
        }
        Request.Builder builder = new Request.Builder()
                .url(baseUrl + path)
                .post(RequestBody.create(json, JSON_MEDIA_TYPE));
        addAuthHeaders(builder, json);
        return execute("POST " + path, builder.build());
    }

    private void addAuthHeaders(Request.Builder builder, String payload) {
        String timestamp = Long.toString(clock.getAsLong());
        String recvWindow = Long.toString(recvWindowMs);
        String signature = sign(timestamp + apiKey + recvWindow + payload, apiSecret);
        builder.addHeader("X-BAPI-API-KEY", apiKey)
                .addHeader("X-BAPI-TIMESTAMP", timestamp)
                .addHeader("X-BAPI-RECV-WINDOW", recvWindow)
                .addHeader("X-BAPI-SIGN", signature)
                .addHeader("Content-Type", "application/json");
    }

    private String execute(String operation, Request request) throws ExchangeException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw ExchangeErrorClassifier.fromHttpStatus(operation, response.code(), body);
            }
            return body;
        } catch (IOException e) {
            throw ExchangeErrorClassifier.fromIOException(operation, e);
        }
    }

    /**
     * 参数按键名排序，保证签名与实际发送一致
     */
    static String buildQueryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        Map<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("&");
            }
            sb.append(urlEncode(entry.getKey()))
                    .append("=")
                    .append(urlEncode(entry.getValue()));
        }
        return sb.toString();
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20");
    }

    static String sign(String data, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Sign failed", e);
        }
    }
}
