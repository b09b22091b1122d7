package com.tide.qc.statistics;

import com.tide.qc.core.SampleSeries;

/**
 * 回看窗口提取器
 *
 * 窗口为 [max(0, i - interval), i - 1]。
 * i < minEntries 时处于预热期，不评估；
 * 窗口内有效值少于 minEntries - 1 时跳过该点。
 */
public class WindowExtractor {

    private final int interval;
    private final int minEntries;

    public WindowExtractor(int interval, int minEntries) {
        if (interval <= 0) {
            throw new IllegalArgumentException("回看长度必须大于0");
        }
        if (minEntries <= 0) {
            throw new IllegalArgumentException("最少样本数必须大于0");
        }
        this.interval = interval;
        this.minEntries = minEntries;
    }

    public boolean isWarmUp(int index) {
        return index < minEntries;
    }

    public SampleWindow extract(SampleSeries series, int index) {
        if (index < 0 || index > series.size()) {
            throw new IndexOutOfBoundsException("下标越界: " + index);
        }
        int from = Math.max(0, index - interval);
        return new SampleWindow(from, index, series.subList(from, index));
    }

    public boolean hasEnoughEntries(SampleWindow window) {
        return window.getValidCount() >= minEntries - 1;
    }

    public int getInterval() {
        return interval;
    }

    public int getMinEntries() {
        return minEntries;
    }
}
