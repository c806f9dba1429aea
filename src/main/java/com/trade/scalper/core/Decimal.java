package com.trade.scalper.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * BigDecimal 工具类
 * 所有金额、价格、数量计算必须使用此类，禁止 double
 */
public final class Decimal {

    private Decimal() {}

    /**
     * 向下取整到步长的整数倍
     */
    public static BigDecimal floorToStep(BigDecimal value, BigDecimal step) {
        return toStep(value, step, RoundingMode.FLOOR);
    }

    /**
     * 向上取整到步长的整数倍
     */
    public static BigDecimal ceilToStep(BigDecimal value, BigDecimal step) {
        return toStep(value, step, RoundingMode.CEILING);
    }

    /**
     * 四舍五入到步长的整数倍
     */
    public static BigDecimal roundToStep(BigDecimal value, BigDecimal step) {
        return toStep(value, step, RoundingMode.HALF_UP);
    }

    private static BigDecimal toStep(BigDecimal value, BigDecimal step, RoundingMode mode) {
        if (!isPositive(step)) {
            return value;
        }
        BigDecimal units = value.divide(step, 0, mode);
        return units.multiply(step).setScale(decimalsOf(step), RoundingMode.UNNECESSARY);
    }

    /**
     * 步长对应的小数位数，如 0.0001 → 4，1 → 0
     */
    public static int decimalsOf(BigDecimal step) {
        if (step == null) {
            return 0;
        }
        return Math.max(0, step.stripTrailingZeros().scale());
    }

    /**
     * 按小数位数得到步长，如 4 → 0.0001
     */
    public static BigDecimal stepOfDecimals(int decimals) {
        return BigDecimal.ONE.movePointLeft(Math.max(0, decimals));
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * 判断是否为正值
     */
    public static boolean isPositive(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) > 0;
    }
}
