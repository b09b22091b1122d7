package com.tide.qc.detector;

import com.tide.qc.core.LabelBuffer;
import com.tide.qc.statistics.ConfidenceInterval;

/**
 * 尖峰判定：原始值落在置信区间外即为尖峰
 */
public class SpikeClassifier {

    public boolean isSpike(double raw, ConfidenceInterval interval) {
        if (Double.isNaN(raw)) {
            return false; // 没有观测值无法判定
        }
        return interval.isOutside(raw);
    }

    /**
     * 判定并写入标签
     */
    public boolean classify(LabelBuffer labels, int index, double raw, ConfidenceInterval interval) {
        boolean spike = isSpike(raw, interval);
        labels.write(index, spike);
        return spike;
    }
}
