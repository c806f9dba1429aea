package com.trade.scalper.indicator;

import com.trade.scalper.core.KLine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 成交量简单移动平均（含最后一根）
 */
public class VolumeSMA implements Indicator {

    private final int period;

    public VolumeSMA(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
    }

    @Override
    public BigDecimal latest(List<KLine> kLines) {
        if (kLines.size() < period) {
            return null;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = kLines.size() - period; i < kLines.size(); i++) {
            sum = sum.add(kLines.get(i).getVolume());
        }
        return sum.divide(BigDecimal.valueOf(period), 10, RoundingMode.HALF_UP);
    }

    @Override
    public String getName() {
        return "VolumeSMA-" + period;
    }
}
