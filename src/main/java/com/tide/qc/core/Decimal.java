package com.tide.qc.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * BigDecimal 工具类
 * 置信区间取整和评估指标格式化统一走这里
 */
public final class Decimal {

    private Decimal() {}

    /**
     * 水位精度：3位小数（毫米）
     */
    private static final int LEVEL_SCALE = 3;

    /**
     * 评估指标精度：5位小数
     */
    private static final int METRIC_SCALE = 5;

    /**
     * 水位取整（3位小数，银行家舍入）
     */
    public static double roundLevel(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(LEVEL_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * 安全比率（5位小数），分母为零返回 0
     */
    public static BigDecimal ratio(long numerator, long denominator) {
        if (denominator == 0) {
            return BigDecimal.ZERO.setScale(METRIC_SCALE, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(numerator)
                .divide(BigDecimal.valueOf(denominator), METRIC_SCALE, RoundingMode.HALF_UP);
    }
}
