package com.trade.scalper.indicator;

import com.trade.scalper.core.KLine;

import java.math.BigDecimal;
import java.util.List;

/**
 * 基于已收盘K线序列的技术指标
 */
public interface Indicator {

    /**
     * 计算最后一根K线上的指标值
     * @param kLines 按开盘时间升序
     * @return 数据不足时返回 null
     */
    BigDecimal latest(List<KLine> kLines);

    /**
     * 获取指标名称
     */
    String getName();
}
