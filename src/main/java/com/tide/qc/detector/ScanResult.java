package com.tide.qc.detector;

/**
 * 扫描结果
 * labels 与输入序列逐行对齐，未评估的点保持 false
 */
public class ScanResult {

    private final boolean[] labels;        // 预测尖峰标签
    private final boolean[] evaluated;     // 是否实际参与判定
    private final int completed;           // 已完成的下标数
    private final int warmUpCount;         // 预热期点数
    private final int skippedCount;        // 有效值不足而跳过的点数
    private final int flaggedCount;        // 判定为尖峰的点数
    private final boolean cancelled;

    public ScanResult(boolean[] labels, boolean[] evaluated, int completed,
                      int warmUpCount, int skippedCount, int flaggedCount, boolean cancelled) {
        this.labels = labels;
        this.evaluated = evaluated;
        this.completed = completed;
        this.warmUpCount = warmUpCount;
        this.skippedCount = skippedCount;
        this.flaggedCount = flaggedCount;
        this.cancelled = cancelled;
    }

    public boolean[] getLabels() { return labels.clone(); }
    public boolean isSpike(int index) { return labels[index]; }
    public boolean isEvaluated(int index) { return evaluated[index]; }
    public int size() { return labels.length; }
    public int getCompleted() { return completed; }
    public int getWarmUpCount() { return warmUpCount; }
    public int getSkippedCount() { return skippedCount; }
    public int getFlaggedCount() { return flaggedCount; }
    public boolean isCancelled() { return cancelled; }

    public int getEvaluatedCount() {
        int count = 0;
        for (boolean e : evaluated) {
            if (e) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format(
                """
                ==================== 扫描结果 ====================
                总行数:          %d
                已完成:          %d%s
                预热期:          %d
                跳过:            %d
                参与判定:        %d
                判定为尖峰:      %d
                ================================================
                """,
                labels.length, completed, cancelled ? " (已取消)" : "",
                warmUpCount, skippedCount, getEvaluatedCount(), flaggedCount
        );
    }
}
