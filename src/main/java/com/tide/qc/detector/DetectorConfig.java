package com.tide.qc.detector;

import com.tide.qc.core.ConfigManager;
import com.tide.qc.statistics.EmpiricalQuantile;

/**
 * 尖峰检测配置
 * 从配置文件加载或通过 Builder 创建
 */
public class DetectorConfig {

    private final double periodDays;
    private final int samplingPeriodMinutes;
    private final int minEntries;
    private final int nbins;
    private final double cdfLower;
    private final double cdfUpper;
    private final double buffer;

    private DetectorConfig(Builder builder) {
        this.periodDays = builder.periodDays;
        this.samplingPeriodMinutes = builder.samplingPeriodMinutes;
        this.minEntries = builder.minEntries;
        this.nbins = builder.nbins;
        this.cdfLower = builder.cdfLower;
        this.cdfUpper = builder.cdfUpper;
        this.buffer = builder.buffer;
    }

    /**
     * 从配置文件加载
     */
    public static DetectorConfig fromProperties(ConfigManager config) {
        return DetectorConfig.builder()
                .periodDays(config.getDoubleProperty("detector.period.days", 1))
                .samplingPeriodMinutes(config.getIntProperty("detector.sampling.period.minutes", 6))
                .minEntries(config.getIntProperty("detector.min.entries", 100))
                .nbins(config.getIntProperty("detector.nbins", 80))
                .cdfLimits(config.getDoubleProperty("detector.cdf.lower", EmpiricalQuantile.DEFAULT_LOWER_LIMIT),
                        config.getDoubleProperty("detector.cdf.upper", EmpiricalQuantile.DEFAULT_UPPER_LIMIT))
                .buffer(config.getDoubleProperty("detector.buffer", 0.15))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getPeriodDays() { return periodDays; }
    public int getSamplingPeriodMinutes() { return samplingPeriodMinutes; }
    public int getMinEntries() { return minEntries; }
    public int getNbins() { return nbins; }
    public double getCdfLower() { return cdfLower; }
    public double getCdfUpper() { return cdfUpper; }
    public double getBuffer() { return buffer; }

    /**
     * 回看长度（样本数）= period * 24 * 60 / 采样间隔
     */
    public int getInterval() {
        return (int) (periodDays * 24 * 60 / samplingPeriodMinutes);
    }

    @Override
    public String toString() {
        return String.format(
                "DetectorConfig{period=%sd, sampling=%dmin, interval=%d, minEntries=%d, nbins=%d, cdfLimits=(%s, %s), buffer=%s}",
                periodDays, samplingPeriodMinutes, getInterval(), minEntries, nbins, cdfLower, cdfUpper, buffer);
    }

    public static class Builder {
        private double periodDays = 1;                                      // 默认回看1天
        private int samplingPeriodMinutes = 6;                              // 6分钟采样
        private int minEntries = 100;
        private int nbins = 80;                                             // 与站点相关
        private double cdfLower = EmpiricalQuantile.DEFAULT_LOWER_LIMIT;    // 约5 sigma
        private double cdfUpper = EmpiricalQuantile.DEFAULT_UPPER_LIMIT;
        private double buffer = 0.15;                                       // 米

        public Builder periodDays(double periodDays) {
            this.periodDays = periodDays;
            return this;
        }

        public Builder samplingPeriodMinutes(int minutes) {
            this.samplingPeriodMinutes = minutes;
            return this;
        }

        public Builder minEntries(int minEntries) {
            this.minEntries = minEntries;
            return this;
        }

        public Builder nbins(int nbins) {
            this.nbins = nbins;
            return this;
        }

        public Builder cdfLimits(double lower, double upper) {
            this.cdfLower = lower;
            this.cdfUpper = upper;
            return this;
        }

        public Builder buffer(double buffer) {
            this.buffer = buffer;
            return this;
        }

        public DetectorConfig build() {
            if (!(periodDays > 0) || samplingPeriodMinutes <= 0) {
                throw new IllegalArgumentException("period 和 samplingPeriodMinutes 必须大于0");
            }
            if (minEntries <= 0 || nbins <= 0) {
                throw new IllegalArgumentException("minEntries 和 nbins 必须大于0");
            }
            if (!(cdfLower > 0 && cdfLower < 0.5 && cdfUpper > 0.5 && cdfUpper < 1)) {
                throw new IllegalArgumentException("cdfLimits 需满足 0 < lower < 0.5 < upper < 1");
            }
            if (!(buffer >= 0)) {
                throw new IllegalArgumentException("buffer 不能为负数");
            }
            DetectorConfig config = new DetectorConfig(this);
            if (config.getInterval() <= 0) {
                throw new IllegalStateException("回看长度不足一个采样点: " + config);
            }
            return config;
        }
    }
}
