package com.tide.qc.statistics;

import com.tide.qc.core.LabelView;
import com.tide.qc.core.Sample;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 经验分布
 *
 * 由窗口内有效且未被标记为尖峰的原始水位构建固定箱数的直方图，
 * 以箱中心为横坐标给出归一化累积分布（单调不减，末值为 1）。
 */
public class EmpiricalDistribution {

    private final int[] counts;
    private final double[] binCenters;
    private final double[] cdf;
    private final int total;
    private final double min;
    private final double max;

    private EmpiricalDistribution(int[] counts, double[] binCenters, int total, double min, double max) {
        this.counts = counts;
        this.binCenters = binCenters;
        this.total = total;
        this.min = min;
        this.max = max;
        this.cdf = new double[counts.length];
        long cumulative = 0;
        for (int i = 0; i < counts.length; i++) {
            cumulative += counts[i];
            cdf[i] = (double) cumulative / total;
        }
    }

    /**
     * 构建窗口的经验分布
     *
     * @param window 回看窗口
     * @param labels 已定稿的尖峰标签
     * @param nbins 直方图箱数
     * @return 过滤后没有可用值时返回 empty
     */
    public static Optional<EmpiricalDistribution> build(SampleWindow window, LabelView labels, int nbins) {
        if (nbins <= 0) {
            throw new IllegalArgumentException("箱数必须大于0");
        }

        List<Sample> samples = window.getSamples();
        double[] values = new double[samples.size()];
        int n = 0;
        for (int offset = 0; offset < samples.size(); offset++) {
            Sample sample = samples.get(offset);
            if (!sample.hasRaw() || labels.isSpike(window.indexOf(offset))) {
                continue;
            }
            values[n++] = sample.getRaw();
        }
        if (n == 0) {
            return Optional.empty();
        }
        return Optional.of(fromValues(Arrays.copyOf(values, n), nbins));
    }

    /**
     * 直接由数值构建，数值必须全部有限
     */
    public static EmpiricalDistribution fromValues(double[] values, int nbins) {
        if (values.length == 0) {
            throw new IllegalArgumentException("数值不能为空");
        }
        if (nbins <= 0) {
            throw new IllegalArgumentException("箱数必须大于0");
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        int[] counts = new int[nbins];
        double[] centers = new double[nbins];
        double span = max - min;

        if (span == 0) {
            // 零离散：点质量分布，所有箱中心都落在该值上
            Arrays.fill(centers, min);
            counts[0] = values.length;
            return new EmpiricalDistribution(counts, centers, values.length, min, max);
        }

        double width = span / nbins;
        for (int k = 0; k < nbins; k++) {
            double left = min + k * width;
            double right = k == nbins - 1 ? max : min + (k + 1) * width;
            centers[k] = left + (right - left) / 2;
        }
        for (double value : values) {
            int bin = (int) ((value - min) / span * nbins);
            if (bin >= nbins) {
                bin = nbins - 1; // 最后一个箱右侧闭合
            }
            counts[bin]++;
        }
        return new EmpiricalDistribution(counts, centers, values.length, min, max);
    }

    public int[] getCounts() {
        return counts.clone();
    }

    public double[] getBinCenters() {
        return binCenters.clone();
    }

    public double[] getCdf() {
        return cdf.clone();
    }

    public int getBinCount() {
        return counts.length;
    }

    double binCenter(int bin) {
        return binCenters[bin];
    }

    double cumulative(int bin) {
        return cdf[bin];
    }

    public int getTotal() {
        return total;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMinBinCenter() {
        return binCenters[0];
    }

    public double getMaxBinCenter() {
        return binCenters[binCenters.length - 1];
    }
}
