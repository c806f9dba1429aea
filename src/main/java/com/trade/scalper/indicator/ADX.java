package com.trade.scalper.indicator;

import com.trade.scalper.core.KLine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 平均趋向指数（Average Directional Index），衡量趋势强度
 * 需要 2 × period 根K线
 */
public class ADX implements Indicator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final int period;

    public ADX(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
    }

    @Override
    public BigDecimal latest(List<KLine> kLines) {
        if (kLines.size() < period * 2) {
            return null;
        }
        BigDecimal n = BigDecimal.valueOf(period);

        BigDecimal smoothTr = BigDecimal.ZERO;
        BigDecimal smoothPlusDm = BigDecimal.ZERO;
        BigDecimal smoothMinusDm = BigDecimal.ZERO;
        for (int i = 1; i <= period; i++) {
            smoothTr = smoothTr.add(ATR.trueRange(kLines, i));
            smoothPlusDm = smoothPlusDm.add(plusDm(kLines, i));
            smoothMinusDm = smoothMinusDm.add(minusDm(kLines, i));
        }

        BigDecimal dxSum = dx(smoothPlusDm, smoothMinusDm, smoothTr);
        int dxCount = 1;
        BigDecimal adx = period == 1 ? dxSum : null;
        for (int i = period + 1; i < kLines.size(); i++) {
            // Wilder 平滑: S = S - S/period + 当前值
            smoothTr = smoothTr.subtract(smoothTr.divide(n, 10, RoundingMode.HALF_UP)).add(ATR.trueRange(kLines, i));
            smoothPlusDm = smoothPlusDm.subtract(smoothPlusDm.divide(n, 10, RoundingMode.HALF_UP)).add(plusDm(kLines, i));
            smoothMinusDm = smoothMinusDm.subtract(smoothMinusDm.divide(n, 10, RoundingMode.HALF_UP)).add(minusDm(kLines, i));
            BigDecimal dx = dx(smoothPlusDm, smoothMinusDm, smoothTr);
            if (adx == null) {
                dxSum = dxSum.add(dx);
                dxCount++;
                if (dxCount == period) {
                    adx = dxSum.divide(n, 10, RoundingMode.HALF_UP);
                }
            } else {
                adx = adx.multiply(BigDecimal.valueOf(period - 1)).add(dx).divide(n, 10, RoundingMode.HALF_UP);
            }
        }
        return adx;
    }

    private BigDecimal plusDm(List<KLine> kLines, int i) {
        BigDecimal up = kLines.get(i).getHigh().subtract(kLines.get(i - 1).getHigh());
        BigDecimal down = kLines.get(i - 1).getLow().subtract(kLines.get(i).getLow());
        return up.compareTo(down) > 0 && up.signum() > 0 ? up : BigDecimal.ZERO;
    }

    private BigDecimal minusDm(List<KLine> kLines, int i) {
        BigDecimal up = kLines.get(i).getHigh().subtract(kLines.get(i - 1).getHigh());
        BigDecimal down = kLines.get(i - 1).getLow().subtract(kLines.get(i).getLow());
        return down.compareTo(up) > 0 && down.signum() > 0 ? down : BigDecimal.ZERO;
    }

    private BigDecimal dx(BigDecimal plusDm, BigDecimal minusDm, BigDecimal tr) {
        if (tr.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal plusDi = HUNDRED.multiply(plusDm).divide(tr, 10, RoundingMode.HALF_UP);
        BigDecimal minusDi = HUNDRED.multiply(minusDm).divide(tr, 10, RoundingMode.HALF_UP);
        BigDecimal sum = plusDi.add(minusDi);
        if (sum.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return HUNDRED.multiply(plusDi.subtract(minusDi).abs()).divide(sum, 10, RoundingMode.HALF_UP);
    }

    @Override
    public String getName() {
        return "ADX-" + period;
    }
}
