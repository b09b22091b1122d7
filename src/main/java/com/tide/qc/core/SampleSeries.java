package com.tide.qc.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 有序水位时间序列
 * 按时间严格递增，只通过下标访问
 */
public class SampleSeries {

    private final List<Sample> samples;

    public SampleSeries(List<Sample> samples) {
        if (samples == null) {
            throw new IllegalArgumentException("样本列表不能为空");
        }
        for (int i = 1; i < samples.size(); i++) {
            if (!samples.get(i).getTime().isAfter(samples.get(i - 1).getTime())) {
                throw new IllegalArgumentException(
                        "时间序列必须严格递增: 第 " + i + " 行 " + samples.get(i).getTime());
            }
        }
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
    }

    public Sample get(int index) {
        return samples.get(index);
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public List<Sample> getSamples() {
        return samples;
    }

    /**
     * 子区间视图 [fromIndex, toIndex)
     */
    public List<Sample> subList(int fromIndex, int toIndex) {
        return samples.subList(fromIndex, toIndex);
    }

    /**
     * 按缓冲容差生成真实尖峰标签
     */
    public boolean[] groundTruth(double buffer) {
        boolean[] truth = new boolean[samples.size()];
        for (int i = 0; i < truth.length; i++) {
            truth[i] = samples.get(i).isTrueSpike(buffer);
        }
        return truth;
    }
}
