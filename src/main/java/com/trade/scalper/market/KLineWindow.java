package com.trade.scalper.market;

import com.trade.scalper.core.KLine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 已确认K线的滚动窗口，按开盘时间严格递增，超出容量丢弃最旧的
 * 非线程安全，由交易引擎在行情回调中独占使用
 */
public class KLineWindow {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<KLine> kLines;

    public KLineWindow() {
        this(DEFAULT_CAPACITY);
    }

    public KLineWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("窗口容量必须大于0");
        }
        this.capacity = capacity;
        this.kLines = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * 加入一根K线
     * @return 未确认或不比最后一根新时返回 false
     */
    public boolean add(KLine kLine) {
        if (!kLine.isConfirmed()) {
            return false;
        }
        KLine last = kLines.peekLast();
        if (last != null && !kLine.getOpenTime().isAfter(last.getOpenTime())) {
            return false;
        }
        kLines.addLast(kLine);
        while (kLines.size() > capacity) {
            kLines.removeFirst();
        }
        return true;
    }

    public int size() {
        return kLines.size();
    }

    public KLine last() {
        return kLines.peekLast();
    }

    public List<KLine> snapshot() {
        return List.copyOf(kLines);
    }
}
