package com.trade.scalper.market;

import com.trade.scalper.core.Interval;
import com.trade.scalper.core.KLine;
import com.trade.scalper.core.Symbol;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class KLineWindowTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    void add_shouldRejectUnconfirmedAndOutOfOrderCandles() {
        KLineWindow window = new KLineWindow(10);

        assertTrue(window.add(kLine(1, "100", true)));
        assertFalse(window.add(kLine(2, "101", false)));
        assertFalse(window.add(kLine(1, "102", true)));
        assertFalse(window.add(kLine(0, "99", true)));
        assertTrue(window.add(kLine(2, "103", true)));

        assertEquals(2, window.size());
        assertEquals(0, new BigDecimal("103").compareTo(window.last().getClose()));
    }

    @Test
    void add_shouldEvictOldestBeyondCapacity() {
        KLineWindow window = new KLineWindow(3);
        for (int i = 0; i < 5; i++) {
            window.add(kLine(i, Integer.toString(100 + i), true));
        }

        assertEquals(3, window.size());
        assertEquals(START.plusSeconds(120), window.snapshot().get(0).getOpenTime());
        assertEquals(0, new BigDecimal("102").compareTo(window.snapshot().get(0).getClose()));
        assertEquals(0, new BigDecimal("104").compareTo(window.last().getClose()));
    }

    @Test
    void constructor_shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new KLineWindow(0));
    }

    private static KLine kLine(int minute, String close, boolean confirmed) {
        Instant open = START.plusSeconds(60L * minute);
        BigDecimal price = new BigDecimal(close);
        return new KLine(Symbol.of("BTCUSDT"), Interval.ONE_MINUTE, open, open.plusSeconds(59),
                price, price, price, price, BigDecimal.ONE, price, confirmed);
    }
}
