package com.tide.qc.evaluation;

import com.tide.qc.core.SampleSeries;
import com.tide.qc.detector.ScanResult;

/**
 * 将判定标签与真实标签汇总为混淆矩阵
 * 只统计实际参与判定的点（不含预热期和跳过的点）
 */
public class SpikeEvaluator {

    private final double buffer;

    public SpikeEvaluator(double buffer) {
        this.buffer = buffer;
    }

    public EvaluationResult evaluate(SampleSeries series, ScanResult result) {
        if (series.size() != result.size()) {
            throw new IllegalArgumentException(
                    "标签长度与序列不一致: " + result.size() + " != " + series.size());
        }
        boolean[] truth = series.groundTruth(buffer);
        long tn = 0, fp = 0, fn = 0, tp = 0;

        for (int i = 0; i < truth.length; i++) {
            if (!result.isEvaluated(i)) {
                continue;
            }
            boolean pred = result.isSpike(i);
            if (truth[i]) {
                if (pred) tp++; else fn++;
            } else {
                if (pred) fp++; else tn++;
            }
        }
        return new EvaluationResult(new ConfusionMatrix(tn, fp, fn, tp));
    }
}
