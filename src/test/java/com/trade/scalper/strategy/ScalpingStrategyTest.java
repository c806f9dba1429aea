package com.trade.scalper.strategy;

import com.trade.scalper.core.Position;
import com.trade.scalper.core.Symbol;
import com.trade.scalper.indicator.IndicatorSnapshot;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScalpingStrategyTest {

    private static final Instant OPENED = Instant.parse("2024-05-01T00:00:00Z");

    private final ScalpingStrategy strategy = new ScalpingStrategy(ScalpingConfig.builder().build());

    @Test
    void evaluateEntry_shouldEnterWhenAllConditionsHold() {
        EntryDecision decision = strategy.evaluateEntry(indicators("101", "100", "30", "55", "2", "1"));

        assertTrue(decision.enter());
        assertEquals(EntryReason.OK, decision.reason());
    }

    @Test
    void entryDecision_factoriesShouldSetEnterFlag() {
        EntryDecision accepted = EntryDecision.accept();
        EntryDecision rejected = EntryDecision.reject(EntryReason.LATERAL);

        assertTrue(accepted.enter());
        assertFalse(accepted.isPartialMatch());
        assertFalse(rejected.enter());
        assertTrue(rejected.isPartialMatch());
    }

    @Test
    void evaluateEntry_shouldReportReasonCodesForPartialMatches() {
        EntryDecision lateral = strategy.evaluateEntry(indicators("101", "100", "25", "55", "2", "1"));
        EntryDecision overbought = strategy.evaluateEntry(indicators("101", "100", "30", "68", "2", "1"));
        EntryDecision lowVolume = strategy.evaluateEntry(indicators("101", "100", "30", "55", "1.2", "1"));

        assertEquals("lateral", lateral.reason().getCode());
        assertEquals("rsi_overbought", overbought.reason().getCode());
        assertEquals("low_volume", lowVolume.reason().getCode());
        assertTrue(lateral.isPartialMatch());
        assertTrue(overbought.isPartialMatch());
        assertTrue(lowVolume.isPartialMatch());
    }

    @Test
    void evaluateEntry_shouldNotEnterWithoutCrossOrData() {
        EntryDecision bearish = strategy.evaluateEntry(indicators("100", "100", "30", "55", "2", "1"));
        EntryDecision empty = strategy.evaluateEntry(IndicatorSnapshot.empty());

        assertFalse(bearish.enter());
        assertEquals(EntryReason.NO_SIGNAL, bearish.reason());
        assertFalse(bearish.isPartialMatch());
        assertEquals(EntryReason.INSUFFICIENT_DATA, empty.reason());
    }

    @Test
    void evaluateEntry_shouldSkipVolumeFilterWhenDisabled() {
        ScalpingStrategy noVolume = new ScalpingStrategy(ScalpingConfig.builder()
                .volumeMultiplier(BigDecimal.ZERO)
                .build());
        Map<String, BigDecimal> values = new HashMap<>();
        values.put(IndicatorSnapshot.EMA_FAST, new BigDecimal("101"));
        values.put(IndicatorSnapshot.EMA_SLOW, new BigDecimal("100"));
        values.put(IndicatorSnapshot.ADX, new BigDecimal("30"));
        values.put(IndicatorSnapshot.RSI, new BigDecimal("55"));

        assertTrue(noVolume.evaluateEntry(IndicatorSnapshot.of(values)).enter());
    }

    @Test
    void evaluateExit_shouldTakeProfitAtThreshold() {
        Position position = position("100", "99.5");

        assertEquals(0, new BigDecimal("100.3").compareTo(strategy.takeProfitPrice(new BigDecimal("100"))));
        assertEquals(Optional.empty(), strategy.evaluateExit(position, new BigDecimal("100.29"), OPENED.plusSeconds(60)));
        assertEquals(Optional.of(ExitReason.TAKE_PROFIT),
                strategy.evaluateExit(position, new BigDecimal("100.3"), OPENED.plusSeconds(60)));
    }

    @Test
    void evaluateExit_shouldStopLossAndTimeOutInOrder() {
        Position position = position("100", "99.5");

        assertEquals(Optional.of(ExitReason.STOP_LOSS),
                strategy.evaluateExit(position, new BigDecimal("99.5"), OPENED.plus(Duration.ofHours(1))));
        assertEquals(Optional.empty(),
                strategy.evaluateExit(position, new BigDecimal("100"), OPENED.plus(Duration.ofMinutes(20))));
        assertEquals(Optional.of(ExitReason.TIMEOUT),
                strategy.evaluateExit(position, new BigDecimal("100"), OPENED.plus(Duration.ofMinutes(20)).plusSeconds(1)));
    }

    @Test
    void stopLossPrice_shouldUseAtrWhenAvailable() {
        Map<String, BigDecimal> values = new HashMap<>();
        values.put(IndicatorSnapshot.ATR, new BigDecimal("0.2"));

        BigDecimal atrStop = strategy.stopLossPrice(new BigDecimal("100"), IndicatorSnapshot.of(values));
        BigDecimal pctStop = strategy.stopLossPrice(new BigDecimal("100"), IndicatorSnapshot.empty());

        assertEquals(0, new BigDecimal("99.7").compareTo(atrStop));
        assertEquals(0, new BigDecimal("99.5").compareTo(pctStop));
    }

    @Test
    void stopLossPrice_shouldFallBackToPercentWhenAtrStopNotPositive() {
        Map<String, BigDecimal> values = new HashMap<>();
        values.put(IndicatorSnapshot.ATR, new BigDecimal("100"));

        BigDecimal stop = strategy.stopLossPrice(new BigDecimal("100"), IndicatorSnapshot.of(values));

        assertEquals(0, new BigDecimal("99.5").compareTo(stop));
    }

    @Test
    void builder_shouldRejectInvalidValues() {
        assertThrows(IllegalStateException.class,
                () -> ScalpingConfig.builder().riskPerTrade(BigDecimal.ZERO).build());
        assertThrows(IllegalStateException.class,
                () -> ScalpingConfig.builder().stopLossPct(BigDecimal.ONE).build());
    }

    private static Position position(String entry, String stopLoss) {
        return new Position(Symbol.of("BTCUSDT"), new BigDecimal(entry), new BigDecimal("2"), OPENED,
                new BigDecimal(stopLoss));
    }

    private static IndicatorSnapshot indicators(String emaFast, String emaSlow, String adx, String rsi,
                                                String volume, String volumeSma) {
        Map<String, BigDecimal> values = new HashMap<>();
        values.put(IndicatorSnapshot.EMA_FAST, new BigDecimal(emaFast));
        values.put(IndicatorSnapshot.EMA_SLOW, new BigDecimal(emaSlow));
        values.put(IndicatorSnapshot.ADX, new BigDecimal(adx));
        values.put(IndicatorSnapshot.RSI, new BigDecimal(rsi));
        values.put(IndicatorSnapshot.VOLUME, new BigDecimal(volume));
        values.put(IndicatorSnapshot.VOLUME_SMA, new BigDecimal(volumeSma));
        return IndicatorSnapshot.of(values);
    }
}
