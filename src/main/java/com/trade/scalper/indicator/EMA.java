package com.trade.scalper.indicator;

import com.trade.scalper.core.KLine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 收盘价指数移动平均线（Exponential Moving Average）
 * 以前 period 根的 SMA 为初值
 */
public class EMA implements Indicator {

    private final int period;
    private final BigDecimal multiplier;

    public EMA(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
        // 平滑系数 = 2 / (period + 1)
        this.multiplier = BigDecimal.valueOf(2).divide(BigDecimal.valueOf(period + 1), 10, RoundingMode.HALF_UP);
    }

    @Override
    public BigDecimal latest(List<KLine> kLines) {
        if (kLines.size() < period) {
            return null;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = 0; i < period; i++) {
            sum = sum.add(kLines.get(i).getClose());
        }
        BigDecimal ema = sum.divide(BigDecimal.valueOf(period), 10, RoundingMode.HALF_UP);
        for (int i = period; i < kLines.size(); i++) {
            BigDecimal close = kLines.get(i).getClose();
            ema = close.subtract(ema).multiply(multiplier).add(ema)
                    .setScale(10, RoundingMode.HALF_UP);
        }
        return ema;
    }

    @Override
    public String getName() {
        return "EMA-" + period;
    }
}
