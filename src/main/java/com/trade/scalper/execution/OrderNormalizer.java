package com.trade.scalper.execution;

import com.trade.scalper.core.Decimal;
import com.trade.scalper.core.SymbolFilters;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 下单数量与价格规范化，纯函数
 *
 * 买入向上取整（不少买），卖出向下取整（不超卖）；
 * 买入金额不足最小下单金额时加量，卖出不足时直接失败，不发送注定被拒的订单。
 */
public final class OrderNormalizer {

    private static final int DIVIDE_SCALE = 18;

    private OrderNormalizer() {
    }

    /**
     * 按报价货币金额买入时的下单金额：max(金额, 最小下单金额) × 缓冲系数，按报价精度向上取整
     */
    public static BigDecimal quoteAmount(BigDecimal amount, SymbolFilters filters, BigDecimal buffer) {
        if (!Decimal.isPositive(amount)) {
            throw new IllegalArgumentException("下单金额必须大于0: " + amount);
        }
        BigDecimal clamped = Decimal.max(amount, filters.getMinNotional());
        BigDecimal factor = Decimal.isPositive(buffer) ? buffer : BigDecimal.ONE;
        return Decimal.ceilToStep(clamped.multiply(factor), filters.getQuotePrecision());
    }

    /**
     * 按基础货币数量买入：向上取整到步长，不低于最小数量，金额不足时加量到刚好满足最小下单金额
     */
    public static BigDecimal buyQuantity(BigDecimal desired, BigDecimal price, SymbolFilters filters)
            throws ExecutionException {
        if (!Decimal.isPositive(price)) {
            throw new ExecutionException("缺少有效价格，无法计算买入数量: " + price);
        }
        if (!Decimal.isPositive(desired)) {
            throw new ExecutionException("买入数量必须大于0: " + desired);
        }
        BigDecimal step = filters.getQtyStep();
        BigDecimal minQty = Decimal.ceilToStep(filters.getMinQty(), step);

        BigDecimal qty = Decimal.max(Decimal.ceilToStep(desired, step), minQty);
        if (qty.multiply(price).compareTo(filters.getMinNotional()) < 0) {
            BigDecimal required = filters.getMinNotional().divide(price, DIVIDE_SCALE, RoundingMode.CEILING);
            qty = Decimal.max(Decimal.ceilToStep(required, step), minQty);
        }
        if (filters.getMaxQty() != null && Decimal.isPositive(filters.getMaxQty())
                && qty.compareTo(filters.getMaxQty()) > 0) {
            throw new ExecutionException("买入数量 " + qty.toPlainString()
                    + " 超过最大数量 " + filters.getMaxQty().toPlainString());
        }
        return qty;
    }

    /**
     * 按报价货币预算换算成基础货币数量后买入
     */
    public static BigDecimal buyQuantityForSpend(BigDecimal spend, BigDecimal price, SymbolFilters filters)
            throws ExecutionException {
        if (!Decimal.isPositive(price)) {
            throw new ExecutionException("缺少有效价格，无法计算买入数量: " + price);
        }
        BigDecimal desired = spend.divide(price, DIVIDE_SCALE, RoundingMode.HALF_UP);
        return buyQuantity(desired, price, filters);
    }

    /**
     * 卖出数量：不超过可用余额，向下取整到步长；为零、低于最小数量或金额不足时失败
     */
    public static BigDecimal sellQuantity(BigDecimal desired, BigDecimal available, BigDecimal price,
                                          SymbolFilters filters) throws ExecutionException {
        if (!Decimal.isPositive(price)) {
            throw new ExecutionException("缺少有效价格，无法校验卖出金额: " + price);
        }
        BigDecimal capped = available == null ? desired : Decimal.min(desired, available);
        BigDecimal qty = Decimal.floorToStep(Decimal.max(capped, BigDecimal.ZERO), filters.getQtyStep());
        if (qty.signum() == 0) {
            throw new InsufficientBalanceException(String.format(
                    "%s 可卖数量为0（请求 %s，可用 %s）", filters.getSymbol(), plain(desired), plain(available)));
        }
        if (qty.compareTo(filters.getMinQty()) < 0) {
            throw new InsufficientBalanceException(String.format(
                    "%s 卖出数量 %s 低于最小数量 %s", filters.getSymbol(), qty.toPlainString(), plain(filters.getMinQty())));
        }
        BigDecimal notional = qty.multiply(price);
        if (notional.compareTo(filters.getMinNotional()) < 0) {
            throw new InsufficientBalanceException(String.format(
                    "%s 卖出金额 %s 低于最小下单金额 %s", filters.getSymbol(),
                    notional.toPlainString(), plain(filters.getMinNotional())));
        }
        return qty;
    }

    /**
     * 价格四舍五入到最近的价格步长
     */
    public static BigDecimal roundPrice(BigDecimal price, SymbolFilters filters) throws ExecutionException {
        if (!Decimal.isPositive(price)) {
            throw new ExecutionException("价格必须大于0: " + price);
        }
        BigDecimal rounded = Decimal.roundToStep(price, filters.getPriceTick());
        if (rounded.signum() == 0) {
            throw new ExecutionException("价格 " + price.toPlainString() + " 小于一个价格步长");
        }
        if (filters.getMinPrice() != null && Decimal.isPositive(filters.getMinPrice())
                && rounded.compareTo(filters.getMinPrice()) < 0) {
            throw new ExecutionException("价格 " + rounded.toPlainString() + " 低于最小价格 " + filters.getMinPrice());
        }
        if (filters.getMaxPrice() != null && Decimal.isPositive(filters.getMaxPrice())
                && rounded.compareTo(filters.getMaxPrice()) > 0) {
            throw new ExecutionException("价格 " + rounded.toPlainString() + " 高于最大价格 " + filters.getMaxPrice());
        }
        return rounded;
    }

    private static String plain(BigDecimal value) {
        return value == null ? "-" : value.toPlainString();
    }
}
