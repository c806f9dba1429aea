package com.trade.scalper.indicator;

import com.trade.scalper.core.KLine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 平均真实波幅（Average True Range），用于动态止损
 */
public class ATR implements Indicator {

    private final int period;

    public ATR(int period) {
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
        BigDecimal atr = BigDecimal.ZERO;
        for (int i = 1; i <= period; i++) {
            atr = atr.add(trueRange(kLines, i));
        }
        atr = atr.divide(n, 10, RoundingMode.HALF_UP);

        // ATR = (ATR_prev * (period-1) + TR) / period
        for (int i = period + 1; i < kLines.size(); i++) {
            atr = atr.multiply(BigDecimal.valueOf(period - 1))
                    .add(trueRange(kLines, i))
                    .divide(n, 10, RoundingMode.HALF_UP);
        }
        return atr;
    }

    /**
     * TR = max(H-L, |H-PC|, |L-PC|)
     */
    static BigDecimal trueRange(List<KLine> kLines, int i) {
        KLine current = kLines.get(i);
        BigDecimal prevClose = kLines.get(i - 1).getClose();
        BigDecimal tr1 = current.getHigh().subtract(current.getLow());
        BigDecimal tr2 = current.getHigh().subtract(prevClose).abs();
        BigDecimal tr3 = current.getLow().subtract(prevClose).abs();
        return tr1.max(tr2).max(tr3);
    }

    @Override
    public String getName() {
        return "ATR-" + period;
    }
}
