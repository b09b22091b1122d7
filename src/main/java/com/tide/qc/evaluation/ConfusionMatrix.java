package com.tide.qc.evaluation;

/**
 * 2x2 混淆矩阵
 * true = 真实尖峰, pred = 判定尖峰
 */
public class ConfusionMatrix {

    private final long trueNegative;   // 真实否 / 判定否
    private final long falsePositive;  // 真实否 / 判定是
    private final long falseNegative;  // 真实是 / 判定否
    private final long truePositive;   // 真实是 / 判定是

    public ConfusionMatrix(long trueNegative, long falsePositive, long falseNegative, long truePositive) {
        if (trueNegative < 0 || falsePositive < 0 || falseNegative < 0 || truePositive < 0) {
            throw new IllegalArgumentException("混淆矩阵计数不能为负数");
        }
        this.trueNegative = trueNegative;
        this.falsePositive = falsePositive;
        this.falseNegative = falseNegative;
        this.truePositive = truePositive;
    }

    public long getTrueNegative() { return trueNegative; }
    public long getFalsePositive() { return falsePositive; }
    public long getFalseNegative() { return falseNegative; }
    public long getTruePositive() { return truePositive; }

    public long getTotal() {
        return trueNegative + falsePositive + falseNegative + truePositive;
    }

    @Override
    public String toString() {
        String border = "+----------+----------+----------+";
        return String.join(System.lineSeparator(),
                border,
                String.format("| %-8s | %-8s | %-8s |", "", "pred no", "pred yes"),
                border,
                String.format("| %-8s | %8d | %8d |", "true no", trueNegative, falsePositive),
                border,
                String.format("| %-8s | %8d | %8d |", "true yes", falseNegative, truePositive),
                border);
    }
}
