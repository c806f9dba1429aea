package com.trade.scalper.indicator;

import com.trade.scalper.core.KLine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 相对强弱指标（Relative Strength Index），Wilder 平滑
 */
public class RSI implements Indicator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final int period;

    public RSI(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
    }

    @Override
    public BigDecimal latest(List<KLine> kLines) {
        if (kLines.size() < period + 1) {
            return null;
        }
        BigDecimal n = BigDecimal.valueOf(period);
        BigDecimal avgGain = BigDecimal.ZERO;
        BigDecimal avgLoss = BigDecimal.ZERO;
        for (int i = 1; i <= period; i++) {
            BigDecimal change = change(kLines, i);
            avgGain = avgGain.add(change.max(BigDecimal.ZERO));
            avgLoss = avgLoss.add(change.min(BigDecimal.ZERO).abs());
        }
        avgGain = avgGain.divide(n, 10, RoundingMode.HALF_UP);
        avgLoss = avgLoss.divide(n, 10, RoundingMode.HALF_UP);

        for (int i = period + 1; i < kLines.size(); i++) {
            BigDecimal change = change(kLines, i);
            avgGain = avgGain.multiply(BigDecimal.valueOf(period - 1))
                    .add(change.max(BigDecimal.ZERO))
                    .divide(n, 10, RoundingMode.HALF_UP);
            avgLoss = avgLoss.multiply(BigDecimal.valueOf(period - 1))
                    .add(change.min(BigDecimal.ZERO).abs())
                    .divide(n, 10, RoundingMode.HALF_UP);
        }

        if (avgLoss.signum() == 0) {
            return HUNDRED;
        }
        BigDecimal rs = avgGain.divide(avgLoss, 10, RoundingMode.HALF_UP);
        return HUNDRED.subtract(HUNDRED.divide(BigDecimal.ONE.add(rs), 10, RoundingMode.HALF_UP));
    }

    private BigDecimal change(List<KLine> kLines, int i) {
        return kLines.get(i).getClose().subtract(kLines.get(i - 1).getClose());
    }

    @Override
    public String getName() {
        return "RSI-" + period;
    }
}
