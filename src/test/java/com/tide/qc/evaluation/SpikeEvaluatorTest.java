package com.tide.qc.evaluation;

import com.tide.qc.core.Sample;
import com.tide.qc.core.SampleSeries;
import com.tide.qc.detector.DetectorConfig;
import com.tide.qc.detector.ScanResult;
import com.tide.qc.detector.SpikeScanner;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SpikeEvaluator 单元测试
 */
class SpikeEvaluatorTest {

    private static final Instant START = Instant.parse("2018-08-01T00:00:00Z");

    /**
     * TN=10, FP=2, FN=3, TP=5
     */
    @Test
    void testMetricArithmetic() {
        EvaluationResult result = new EvaluationResult(new ConfusionMatrix(10, 2, 3, 5));

        assertEquals(20, result.getConfusionMatrix().getTotal());
        assertEquals(0, new BigDecimal("0.75").compareTo(result.getAccuracy()));
        assertEquals(new BigDecimal("0.71429"), result.getPrecision());
        assertEquals(new BigDecimal("0.62500"), result.getSensitivity());
        assertEquals(new BigDecimal("0.25000"), result.getErrorRate());
        assertEquals(new BigDecimal("0.83333"), result.getTrueNegativeRate());
        assertEquals(new BigDecimal("0.16667"), result.getFalsePositiveRate());
        assertEquals(new BigDecimal("0.40000"), result.getPrevalence());
    }

    @Test
    void testZeroDenominatorReportsZero() {
        EvaluationResult result = new EvaluationResult(new ConfusionMatrix(10, 0, 0, 0));

        assertEquals(0, result.getPrecision().signum());
        assertEquals(0, result.getSensitivity().signum());
        assertEquals(0, new BigDecimal("1").compareTo(result.getAccuracy()));
    }

    @Test
    void testEvaluateCountsOnlyEvaluatedPoints() {
        boolean[] labels = {false, false, true, true, false, true};
        boolean[] evaluated = {false, true, true, true, true, true};
        // 真实尖峰: 第0行（未评估）、第3行、第4行
        SampleSeries series = series(
                new double[]{2.0, 1.0, 1.0, 2.0, 2.0, 1.0},
                new double[]{1.0, 1.0, 1.0, 1.0, 1.0, 1.0});
        ScanResult scan = new ScanResult(labels, evaluated, 6, 1, 0, 3, false);

        ConfusionMatrix m = new SpikeEvaluator(0.15).evaluate(series, scan).getConfusionMatrix();

        assertEquals(1, m.getTrueNegative());   // 第1行
        assertEquals(2, m.getFalsePositive());  // 第2、5行
        assertEquals(1, m.getFalseNegative());  // 第4行
        assertEquals(1, m.getTruePositive());   // 第3行
        assertEquals(5, m.getTotal());
    }

    @Test
    void testPartitionMatchesEvaluatedCount() {
        Random random = new Random(5);
        int n = 400;
        double[] accepted = new double[n];
        double[] raws = new double[n];
        for (int i = 0; i < n; i++) {
            accepted[i] = 1.2 + 0.6 * Math.sin(2 * Math.PI * i / 124.0);
            raws[i] = accepted[i];
            if (random.nextDouble() < 0.03) {
                raws[i] += 1.5;
            }
            if (i > 60 && i < 90) {
                raws[i] = Double.NaN;
            }
        }
        DetectorConfig config = DetectorConfig.builder().periodDays(0.5).minEntries(50).build();
        SampleSeries input = series(raws, accepted);

        ScanResult scan = new SpikeScanner(config).scan(input);
        EvaluationResult result = new SpikeEvaluator(config.getBuffer()).evaluate(input, scan);

        assertEquals(scan.getEvaluatedCount(), result.getConfusionMatrix().getTotal());
        assertEquals(n - scan.getWarmUpCount() - scan.getSkippedCount(), scan.getEvaluatedCount());
    }

    @Test
    void testLengthMismatchRejected() {
        SampleSeries series = series(new double[]{1.0}, new double[]{1.0});
        ScanResult scan = new ScanResult(new boolean[2], new boolean[2], 2, 2, 0, 0, false);
        assertThrows(IllegalArgumentException.class, () -> new SpikeEvaluator(0.15).evaluate(series, scan));
    }

    @Test
    void testConfusionMatrixTable() {
        String table = new ConfusionMatrix(10, 2, 3, 5).toString();
        assertTrue(table.contains("| true no  |       10 |        2 |"));
        assertTrue(table.contains("| true yes |        3 |        5 |"));
    }

    private static SampleSeries series(double[] raws, double[] accepted) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < raws.length; i++) {
            samples.add(new Sample(START.plusSeconds(360L * i), raws[i], accepted[i]));
        }
        return new SampleSeries(samples);
    }
}
