package com.trade.scalper.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.scalper.core.Interval;
import com.trade.scalper.core.KLine;
import com.trade.scalper.core.Symbol;
import com.trade.scalper.core.Tick;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bybit v5 公共推送消息解析
 */
public class BybitStreamParser {

    public enum Kind {
        TICK,
        KLINES,
        SUBSCRIBED,
        SUBSCRIBE_FAILED,
        PONG,
        IGNORED
    }

    /**
     * 解析结果
     */
    public record Message(Kind kind, Tick tick, List<KLine> kLines, String detail) {

        static Message of(Kind kind, String detail) {
            return new Message(kind, null, List.of(), detail);
        }
    }

    private final ObjectMapper objectMapper;
    private final Symbol symbol;
    private final Interval interval;

    public BybitStreamParser(ObjectMapper objectMapper, Symbol symbol, Interval interval) {
        this.objectMapper = objectMapper;
        this.symbol = symbol;
        this.interval = interval;
    }

    public static String topicFor(FeedMode mode, Symbol symbol, Interval interval) {
        if (mode == FeedMode.TICKER) {
            return "tickers." + symbol.toPairString();
        }
        return "kline." + interval.getExchangeCode() + "." + symbol.toPairString();
    }

    public Message parse(String text) throws IOException {
        JsonNode root = objectMapper.readTree(text);
        String op = root.path("op").asText("");
        if (!op.isEmpty()) {
            boolean success = root.path("success").asBoolean(false);
            String retMsg = root.path("ret_msg").asText("");
            if ("subscribe".equals(op)) {
                return Message.of(success ? Kind.SUBSCRIBED : Kind.SUBSCRIBE_FAILED, retMsg);
            }
            if ("ping".equals(op) || "pong".equals(op)) {
                return Message.of(Kind.PONG, retMsg);
            }
            return Message.of(Kind.IGNORED, op);
        }

        String topic = root.path("topic").asText("");
        JsonNode data = root.path("data");
        if (topic.startsWith("tickers.")) {
            JsonNode row = data.isArray() ? data.path(0) : data;
            String last = row.path("lastPrice").asText("");
            if (last.isBlank()) {
                return Message.of(Kind.IGNORED, topic);
            }
            Instant ts = root.has("ts") ? Instant.ofEpochMilli(root.path("ts").asLong()) : Instant.now();
            return new Message(Kind.TICK, new Tick(symbol, new BigDecimal(last), ts), List.of(), topic);
        }
        if (topic.startsWith("kline.")) {
            List<KLine> kLines = new ArrayList<>();
            for (JsonNode row : data) {
                kLines.add(parseKLine(row));
            }
            return new Message(Kind.KLINES, null, kLines, topic);
        }
        return Message.of(Kind.IGNORED, topic);
    }

    private KLine parseKLine(JsonNode row) throws IOException {
        String open = row.path("open").asText("");
        if (open.isBlank()) {
            throw new IOException("K线推送缺少 open: " + row);
        }
        Instant start = Instant.ofEpochMilli(row.path("start").asLong());
        Instant end = row.has("end")
                ? Instant.ofEpochMilli(row.path("end").asLong())
                : start.plus(interval.getDuration()).minusMillis(1);
        return new KLine(
                symbol,
                interval,
                start,
                end,
                new BigDecimal(open),
                new BigDecimal(row.path("high").asText()),
                new BigDecimal(row.path("low").asText()),
                new BigDecimal(row.path("close").asText()),
                new BigDecimal(row.path("volume").asText("0")),
                new BigDecimal(row.path("turnover").asText("0")),
                row.path("confirm").asBoolean(false)
        );
    }
}
