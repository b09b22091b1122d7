package com.tide.qc.statistics;

/**
 * 置信区间 [lower, upper]，已包含缓冲容差
 */
public class ConfidenceInterval {

    private final double lower;
    private final double upper;

    public ConfidenceInterval(double lower, double upper) {
        if (lower > upper) {
            throw new IllegalArgumentException("置信区间下界不能大于上界: " + lower + " > " + upper);
        }
        this.lower = lower;
        this.upper = upper;
    }

    public double getLower() { return lower; }
    public double getUpper() { return upper; }

    /**
     * 值是否落在区间之外，NaN 不判定为区间外
     */
    public boolean isOutside(double value) {
        return value < lower || value > upper;
    }

    @Override
    public String toString() {
        return String.format("[%.5f, %.5f]", lower, upper);
    }
}
