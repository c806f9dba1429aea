package com.trade.scalper.strategy;

import com.trade.scalper.core.Position;
import com.trade.scalper.indicator.IndicatorSnapshot;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 剥头皮规则集，无状态
 *
 * 开仓：EMA9 > EMA21 且 ADX > 阈值 且 RSI < 阈值 且（启用时）成交量 > 均量 × 倍数
 * 平仓：止盈 → 止损 → 超时，按此顺序检查
 */
public class ScalpingStrategy {

    private final ScalpingConfig config;

    public ScalpingStrategy(ScalpingConfig config) {
        this.config = config;
    }

    public ScalpingConfig getConfig() {
        return config;
    }

    public EntryDecision evaluateEntry(IndicatorSnapshot indicators) {
        BigDecimal emaFast = indicators.get(IndicatorSnapshot.EMA_FAST);
        BigDecimal emaSlow = indicators.get(IndicatorSnapshot.EMA_SLOW);
        BigDecimal adx = indicators.get(IndicatorSnapshot.ADX);
        BigDecimal rsi = indicators.get(IndicatorSnapshot.RSI);
        if (emaFast == null || emaSlow == null || adx == null || rsi == null) {
            return EntryDecision.reject(EntryReason.INSUFFICIENT_DATA);
        }
        BigDecimal volume = indicators.get(IndicatorSnapshot.VOLUME);
        BigDecimal volumeSma = indicators.get(IndicatorSnapshot.VOLUME_SMA);
        if (config.isVolumeFilterEnabled() && (volume == null || volumeSma == null)) {
            return EntryDecision.reject(EntryReason.INSUFFICIENT_DATA);
        }

        if (emaFast.compareTo(emaSlow) <= 0) {
            return EntryDecision.reject(EntryReason.NO_SIGNAL);
        }
        if (adx.compareTo(config.getAdxThreshold()) <= 0) {
            return EntryDecision.reject(EntryReason.LATERAL);
        }
        if (rsi.compareTo(config.getRsiThreshold()) >= 0) {
            return EntryDecision.reject(EntryReason.RSI_OVERBOUGHT);
        }
        if (config.isVolumeFilterEnabled()
                && volume.compareTo(volumeSma.multiply(config.getVolumeMultiplier())) <= 0) {
            return EntryDecision.reject(EntryReason.LOW_VOLUME);
        }
        return EntryDecision.accept();
    }

    public Optional<ExitReason> evaluateExit(Position position, BigDecimal price, Instant now) {
        if (price.compareTo(takeProfitPrice(position.getEntryPrice())) >= 0) {
            return Optional.of(ExitReason.TAKE_PROFIT);
        }
        if (price.compareTo(position.getStopLossPrice()) <= 0) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        if (Duration.between(position.getOpenedAt(), now).compareTo(config.getMaxOpenDuration()) > 0) {
            return Optional.of(ExitReason.TIMEOUT);
        }
        return Optional.empty();
    }

    /**
     * 止盈价 = 开仓价 × (1 + tp)
     */
    public BigDecimal takeProfitPrice(BigDecimal entryPrice) {
        return entryPrice.multiply(BigDecimal.ONE.add(config.getTakeProfitPct()));
    }

    /**
     * 止损价：启用 ATR 且结果为正时为 开仓价 − ATR × 倍数，否则为 开仓价 × (1 − sl)
     */
    public BigDecimal stopLossPrice(BigDecimal entryPrice, IndicatorSnapshot indicators) {
        BigDecimal atr = indicators.get(IndicatorSnapshot.ATR);
        if (config.isAtrStopLoss() && atr != null && atr.signum() > 0) {
            BigDecimal dynamic = entryPrice.subtract(atr.multiply(config.getAtrMultiplier()));
            if (dynamic.signum() > 0) {
                return dynamic;
            }
        }
        return entryPrice.multiply(BigDecimal.ONE.subtract(config.getStopLossPct()));
    }
}
