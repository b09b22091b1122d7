package com.tide.qc.evaluation;

import com.tide.qc.core.Decimal;

import java.math.BigDecimal;

/**
 * 评估结果
 * 所有比率保留5位小数，分母为零时记为 0
 */
public class EvaluationResult {

    private final ConfusionMatrix confusionMatrix;
    private final BigDecimal accuracy;            // (TN+TP)/total
    private final BigDecimal precision;           // TP/(TP+FP)
    private final BigDecimal sensitivity;         // TP/(TP+FN)
    private final BigDecimal errorRate;           // (FP+FN)/total
    private final BigDecimal trueNegativeRate;    // TN/(TN+FP)
    private final BigDecimal falsePositiveRate;   // FP/(TN+FP)
    private final BigDecimal prevalence;          // (TP+FN)/total

    public EvaluationResult(ConfusionMatrix m) {
        long tn = m.getTrueNegative();
        long fp = m.getFalsePositive();
        long fn = m.getFalseNegative();
        long tp = m.getTruePositive();
        long total = m.getTotal();

        this.confusionMatrix = m;
        this.accuracy = Decimal.ratio(tn + tp, total);
        this.precision = Decimal.ratio(tp, tp + fp);
        this.sensitivity = Decimal.ratio(tp, tp + fn);
        this.errorRate = Decimal.ratio(fp + fn, total);
        this.trueNegativeRate = Decimal.ratio(tn, tn + fp);
        this.falsePositiveRate = Decimal.ratio(fp, tn + fp);
        this.prevalence = Decimal.ratio(tp + fn, total);
    }

    public ConfusionMatrix getConfusionMatrix() { return confusionMatrix; }
    public BigDecimal getAccuracy() { return accuracy; }
    public BigDecimal getPrecision() { return precision; }
    public BigDecimal getSensitivity() { return sensitivity; }
    public BigDecimal getErrorRate() { return errorRate; }
    public BigDecimal getTrueNegativeRate() { return trueNegativeRate; }
    public BigDecimal getFalsePositiveRate() { return falsePositiveRate; }
    public BigDecimal getPrevalence() { return prevalence; }

    @Override
    public String toString() {
        return String.format(
                """
                ==================== 评估结果 ====================
                Confusion Matrix
                %s

                accuracy            : %s
                precision           : %s
                sensitivity         : %s
                error rate          : %s
                true negative rate  : %s
                false positive rate : %s
                prevalence          : %s
                ================================================
                """,
                confusionMatrix,
                accuracy, precision, sensitivity, errorRate,
                trueNegativeRate, falsePositiveRate, prevalence
        );
    }
}
