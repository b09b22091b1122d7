package com.tide.qc.statistics;

import com.tide.qc.core.Decimal;

/**
 * 经验分位数估计器
 *
 * F⁻¹(p) 取累积概率 ≥ p 的最小箱中心；找不到时下界退回最小箱中心，
 * 上界退回最大箱中心。结果保留3位小数后向外扩展缓冲容差。
 */
public class EmpiricalQuantile {

    /**
     * 约 5 sigma 的默认分位
     */
    public static final double DEFAULT_LOWER_LIMIT = 0.00023;
    public static final double DEFAULT_UPPER_LIMIT = 0.99977;

    private final double lowerLimit;
    private final double upperLimit;
    private final double buffer;

    public EmpiricalQuantile(double lowerLimit, double upperLimit, double buffer) {
        if (!(lowerLimit > 0 && lowerLimit < 0.5 && upperLimit > 0.5 && upperLimit < 1)) {
            throw new IllegalArgumentException(
                    "分位需满足 0 < pLow < 0.5 < pHigh < 1: " + lowerLimit + ", " + upperLimit);
        }
        if (!(buffer >= 0)) {
            throw new IllegalArgumentException("缓冲容差不能为负数: " + buffer);
        }
        this.lowerLimit = lowerLimit;
        this.upperLimit = upperLimit;
        this.buffer = buffer;
    }

    /**
     * 经验分位函数，没有箱满足时返回 NaN
     */
    public static double quantile(EmpiricalDistribution distribution, double probability) {
        for (int bin = 0; bin < distribution.getBinCount(); bin++) {
            if (distribution.cumulative(bin) >= probability) {
                return distribution.binCenter(bin);
            }
        }
        return Double.NaN;
    }

    public ConfidenceInterval estimate(EmpiricalDistribution distribution) {
        double lower = quantile(distribution, lowerLimit);
        double upper = quantile(distribution, upperLimit);
        if (Double.isNaN(lower)) {
            lower = distribution.getMinBinCenter();
        }
        if (Double.isNaN(upper)) {
            upper = distribution.getMaxBinCenter();
        }
        return new ConfidenceInterval(
                Decimal.roundLevel(lower) - buffer,
                Decimal.roundLevel(upper) + buffer
        );
    }

    public double getLowerLimit() {
        return lowerLimit;
    }

    public double getUpperLimit() {
        return upperLimit;
    }

    public double getBuffer() {
        return buffer;
    }
}
