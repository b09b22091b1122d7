package com.tide.qc;

import com.tide.qc.core.ConfigManager;
import com.tide.qc.core.SampleDataException;
import com.tide.qc.core.SampleSeries;
import com.tide.qc.detector.CsvSampleLoader;
import com.tide.qc.detector.DetectorConfig;
import com.tide.qc.detector.ScanResult;
import com.tide.qc.detector.SpikeScanner;
import com.tide.qc.diagnostic.DiagnosticListenerFactory;
import com.tide.qc.diagnostic.SpikeDiagnosticListener;
import com.tide.qc.evaluation.EvaluationReportWriter;
import com.tide.qc.evaluation.EvaluationResult;
import com.tide.qc.evaluation.SpikeEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 水位尖峰检测主类
 */
public class SpikeDetectionMain {

    private static final Logger logger = LoggerFactory.getLogger(SpikeDetectionMain.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(2);
        }

        Path csv = Paths.get(args[0]);
        String configFile = getArg(args, "--config", null);
        String reportFile = getArg(args, "--report", null);

        try {
            ConfigManager cfg = configFile == null
                    ? ConfigManager.getInstance()
                    : ConfigManager.fromFile(Paths.get(configFile));
            run(csv, cfg, reportFile == null ? null : Paths.get(reportFile));
        } catch (SampleDataException e) {
            logger.error("输入数据错误: {}", e.getMessage(), e);
            System.exit(1);
        } catch (IOException e) {
            logger.error("写入报告失败: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * 加载 -> 扫描 -> 评估
     */
    static EvaluationResult run(Path csv, ConfigManager cfg, Path report) throws SampleDataException, IOException {
        DetectorConfig config = DetectorConfig.fromProperties(cfg);
        SampleSeries series = CsvSampleLoader.fromConfig(cfg).load(csv);
        logger.info("加载水位数据: {} 行 ({})", series.size(), csv);

        ScanResult scan;
        SpikeDiagnosticListener listener = DiagnosticListenerFactory.fromConfig(cfg);
        try {
            scan = new SpikeScanner(config, listener).scan(series);
        } finally {
            listener.close();
        }

        EvaluationResult evaluation = new SpikeEvaluator(config.getBuffer()).evaluate(series, scan);
        System.out.println(scan);
        System.out.println(evaluation);

        if (report != null) {
            new EvaluationReportWriter().write(report, config, scan, evaluation);
            logger.info("评估报告已写入: {}", report.toAbsolutePath());
        }
        return evaluation;
    }

    private static void printUsage() {
        System.out.println("Usage: SpikeDetectionMain <csv> [--config spike-detector.properties] [--report report.json]");
    }

    private static String getArg(String[] args, String key, String def) {
        for (int i = 1; i < args.length - 1; i++) {
            if (args[i].equals(key)) {
                return args[i + 1];
            }
        }
        return def;
    }
}
