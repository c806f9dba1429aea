package com.trade.scalper.indicator;

import com.trade.scalper.core.KLine;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 计算剥头皮策略使用的全部指标：EMA9/21、ADX14、RSI14、ATR14、20根成交量均值
 */
public class KLineIndicatorCalculator {

    /**
     * 少于该数量的K线不计算任何指标
     */
    public static final int MIN_BARS = 25;

    private final EMA fastEma = new EMA(9);
    private final EMA slowEma = new EMA(21);
    private final ADX adx = new ADX(14);
    private final RSI rsi = new RSI(14);
    private final ATR atr = new ATR(14);
    private final VolumeSMA volumeSma = new VolumeSMA(20);

    public IndicatorSnapshot calculate(List<KLine> kLines) {
        if (kLines.size() < MIN_BARS) {
            return IndicatorSnapshot.empty();
        }
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        values.put(IndicatorSnapshot.EMA_FAST, fastEma.latest(kLines));
        values.put(IndicatorSnapshot.EMA_SLOW, slowEma.latest(kLines));
        values.put(IndicatorSnapshot.ADX, adx.latest(kLines));
        values.put(IndicatorSnapshot.RSI, rsi.latest(kLines));
        values.put(IndicatorSnapshot.ATR, atr.latest(kLines));
        values.put(IndicatorSnapshot.VOLUME, kLines.get(kLines.size() - 1).getVolume());
        values.put(IndicatorSnapshot.VOLUME_SMA, volumeSma.latest(kLines));
        return IndicatorSnapshot.of(values);
    }
}
