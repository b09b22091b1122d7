package com.tide.qc.statistics;

import com.tide.qc.core.Sample;

import java.util.List;

/**
 * 回看窗口：当前点之前的样本 [fromIndex, toIndex)
 * 只读视图，每个下标重新计算
 */
public class SampleWindow {

    private final int fromIndex;
    private final int toIndex;
    private final List<Sample> samples;
    private final int validCount;

    SampleWindow(int fromIndex, int toIndex, List<Sample> samples) {
        this.fromIndex = fromIndex;
        this.toIndex = toIndex;
        this.samples = samples;
        int valid = 0;
        for (Sample sample : samples) {
            if (sample.hasRaw()) {
                valid++;
            }
        }
        this.validCount = valid;
    }

    public int getFromIndex() { return fromIndex; }
    public int getToIndex() { return toIndex; }
    public List<Sample> getSamples() { return samples; }

    /**
     * 窗口内原始值有效（有限）的样本数
     */
    public int getValidCount() { return validCount; }

    public int size() {
        return samples.size();
    }

    /**
     * 窗口内第 offset 个样本对应的序列下标
     */
    public int indexOf(int offset) {
        return fromIndex + offset;
    }

    @Override
    public String toString() {
        return String.format("SampleWindow{[%d, %d], valid=%d}", fromIndex, toIndex - 1, validCount);
    }
}
