package com.trade.scalper.strategy;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * 剥头皮策略参数
 */
public class ScalpingConfig {

    private BigDecimal riskPerTrade = BigDecimal.valueOf(5);            // 每笔投入（报价货币）
    private BigDecimal takeProfitPct = new BigDecimal("0.003");         // 止盈比例
    private BigDecimal stopLossPct = new BigDecimal("0.005");           // 固定止损比例
    private BigDecimal atrMultiplier = new BigDecimal("1.5");           // ATR止损倍数，<=0 时使用固定比例
    private Duration maxOpenDuration = Duration.ofMinutes(20);          // 最长持仓时间
    private BigDecimal adxThreshold = BigDecimal.valueOf(25);           // ADX 趋势阈值
    private BigDecimal rsiThreshold = BigDecimal.valueOf(68);           // RSI 超买阈值
    private BigDecimal volumeMultiplier = new BigDecimal("1.2");        // 成交量倍数，<=0 时关闭成交量过滤
    private Duration entryCooldown = Duration.ofSeconds(60);            // 开仓失败后的冷却时间

    private ScalpingConfig() {
    }

    public BigDecimal getRiskPerTrade() {
        return riskPerTrade;
    }

    public BigDecimal getTakeProfitPct() {
        return takeProfitPct;
    }

    public BigDecimal getStopLossPct() {
        return stopLossPct;
    }

    public BigDecimal getAtrMultiplier() {
        return atrMultiplier;
    }

    public Duration getMaxOpenDuration() {
        return maxOpenDuration;
    }

    public BigDecimal getAdxThreshold() {
        return adxThreshold;
    }

    public BigDecimal getRsiThreshold() {
        return rsiThreshold;
    }

    public BigDecimal getVolumeMultiplier() {
        return volumeMultiplier;
    }

    public Duration getEntryCooldown() {
        return entryCooldown;
    }

    public boolean isAtrStopLoss() {
        return atrMultiplier != null && atrMultiplier.signum() > 0;
    }

    public boolean isVolumeFilterEnabled() {
        return volumeMultiplier != null && volumeMultiplier.signum() > 0;
    }

    @Override
    public String toString() {
        return String.format("ScalpingConfig{risk=%s, tp=%s, sl=%s, atrMult=%s, maxOpen=%s, adx>%s, rsi<%s, volMult=%s, cooldown=%s}",
                riskPerTrade, takeProfitPct, stopLossPct, atrMultiplier, maxOpenDuration,
                adxThreshold, rsiThreshold, volumeMultiplier, entryCooldown);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final ScalpingConfig config = new ScalpingConfig();

        public Builder riskPerTrade(BigDecimal value) {
            config.riskPerTrade = value;
            return this;
        }

        public Builder takeProfitPct(BigDecimal value) {
            config.takeProfitPct = value;
            return this;
        }

        public Builder stopLossPct(BigDecimal value) {
            config.stopLossPct = value;
            return this;
        }

        public Builder atrMultiplier(BigDecimal value) {
            config.atrMultiplier = value;
            return this;
        }

        public Builder maxOpenDuration(Duration value) {
            config.maxOpenDuration = value;
            return this;
        }

        public Builder adxThreshold(BigDecimal value) {
            config.adxThreshold = value;
            return this;
        }

        public Builder rsiThreshold(BigDecimal value) {
            config.rsiThreshold = value;
            return this;
        }

        public Builder volumeMultiplier(BigDecimal value) {
            config.volumeMultiplier = value;
            return this;
        }

        public Builder entryCooldown(Duration value) {
            config.entryCooldown = value;
            return this;
        }

        public ScalpingConfig build() {
            if (config.riskPerTrade == null || config.riskPerTrade.signum() <= 0) {
                throw new IllegalStateException("每笔投入必须大于0");
            }
            if (config.takeProfitPct == null || config.takeProfitPct.signum() <= 0) {
                throw new IllegalStateException("止盈比例必须大于0");
            }
            if (config.stopLossPct == null || config.stopLossPct.signum() <= 0
                    || config.stopLossPct.compareTo(BigDecimal.ONE) >= 0) {
                throw new IllegalStateException("止损比例必须在 (0, 1) 之间");
            }
            if (config.maxOpenDuration == null || config.maxOpenDuration.isNegative()) {
                throw new IllegalStateException("最长持仓时间不能为负");
            }
            return config;
        }
    }
}
