package com.trade.scalper.indicator;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 最后一根已收盘K线上的指标快照，按名称读取
 * 数据不足的指标不会出现在快照中
 */
public final class IndicatorSnapshot {

    public static final String EMA_FAST = "ema9";
    public static final String EMA_SLOW = "ema21";
    public static final String ADX = "adx14";
    public static final String RSI = "rsi14";
    public static final String ATR = "atr14";
    public static final String VOLUME = "volume";
    public static final String VOLUME_SMA = "volumeSMA";

    private static final IndicatorSnapshot EMPTY = new IndicatorSnapshot(Map.of());

    private final Map<String, BigDecimal> values;

    private IndicatorSnapshot(Map<String, BigDecimal> values) {
        this.values = values;
    }

    public static IndicatorSnapshot empty() {
        return EMPTY;
    }

    public static IndicatorSnapshot of(Map<String, BigDecimal> values) {
        Map<String, BigDecimal> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (value != null) {
                copy.put(name, value);
            }
        });
        return new IndicatorSnapshot(Collections.unmodifiableMap(copy));
    }

    /**
     * @return 缺失时为 null
     */
    public BigDecimal get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Indicators{");
        values.forEach((name, value) -> sb.append(name).append('=')
                .append(value.setScale(4, java.math.RoundingMode.HALF_UP).toPlainString()).append(' '));
        return sb.toString().trim() + "}";
    }
}
