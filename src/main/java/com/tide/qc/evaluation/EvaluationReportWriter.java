package com.tide.qc.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tide.qc.detector.DetectorConfig;
import com.tide.qc.detector.ScanResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 评估报告（JSON）
 */
public class EvaluationReportWriter {

    private final ObjectMapper objectMapper;

    public EvaluationReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Path path, DetectorConfig config, ScanResult scan, EvaluationResult evaluation)
            throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        objectMapper.writeValue(path.toFile(), toReport(config, scan, evaluation));
    }

    Map<String, Object> toReport(DetectorConfig config, ScanResult scan, EvaluationResult evaluation) {
        Map<String, Object> detector = new LinkedHashMap<>();
        detector.put("periodDays", config.getPeriodDays());
        detector.put("samplingPeriodMinutes", config.getSamplingPeriodMinutes());
        detector.put("interval", config.getInterval());
        detector.put("minEntries", config.getMinEntries());
        detector.put("nbins", config.getNbins());
        detector.put("cdfLimits", new double[]{config.getCdfLower(), config.getCdfUpper()});
        detector.put("buffer", config.getBuffer());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("rows", scan.size());
        summary.put("completed", scan.getCompleted());
        summary.put("warmUp", scan.getWarmUpCount());
        summary.put("skipped", scan.getSkippedCount());
        summary.put("evaluated", scan.getEvaluatedCount());
        summary.put("flagged", scan.getFlaggedCount());
        summary.put("cancelled", scan.isCancelled());

        ConfusionMatrix m = evaluation.getConfusionMatrix();
        Map<String, Object> matrix = new LinkedHashMap<>();
        matrix.put("trueNegative", m.getTrueNegative());
        matrix.put("falsePositive", m.getFalsePositive());
        matrix.put("falseNegative", m.getFalseNegative());
        matrix.put("truePositive", m.getTruePositive());

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("accuracy", evaluation.getAccuracy());
        metrics.put("precision", evaluation.getPrecision());
        metrics.put("sensitivity", evaluation.getSensitivity());
        metrics.put("errorRate", evaluation.getErrorRate());
        metrics.put("trueNegativeRate", evaluation.getTrueNegativeRate());
        metrics.put("falsePositiveRate", evaluation.getFalsePositiveRate());
        metrics.put("prevalence", evaluation.getPrevalence());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("detector", detector);
        report.put("scan", summary);
        report.put("confusionMatrix", matrix);
        report.put("metrics", metrics);
        return report;
    }
}
