package com.tide.qc.detector;

import com.tide.qc.core.LabelBuffer;
import com.tide.qc.core.Sample;
import com.tide.qc.core.SampleSeries;
import com.tide.qc.diagnostic.DiagnosticEvent;
import com.tide.qc.diagnostic.NoopDiagnosticListener;
import com.tide.qc.diagnostic.SpikeDiagnosticListener;
import com.tide.qc.statistics.ConfidenceInterval;
import com.tide.qc.statistics.EmpiricalDistribution;
import com.tide.qc.statistics.EmpiricalQuantile;
import com.tide.qc.statistics.SampleWindow;
import com.tide.qc.statistics.WindowExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 顺序扫描器
 *
 * 职责：
 * 1. 按时间顺序逐点提取回看窗口
 * 2. 由窗口构建经验分布并估计置信区间
 * 3. 判定当前点并写回标签，后续窗口据此排除已识别的尖峰
 * 4. 尖峰或误判点交给诊断监听
 *
 * 第 i 点只依赖 [i - interval, i - 1] 中已定稿的标签，因此必须单线程顺序执行。
 */
public class SpikeScanner {

    private static final Logger logger = LoggerFactory.getLogger(SpikeScanner.class);

    private final DetectorConfig config;
    private final WindowExtractor extractor;
    private final EmpiricalQuantile estimator;
    private final SpikeClassifier classifier;
    private final SpikeDiagnosticListener listener;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public SpikeScanner(DetectorConfig config) {
        this(config, NoopDiagnosticListener.INSTANCE);
    }

    public SpikeScanner(DetectorConfig config, SpikeDiagnosticListener listener) {
        this.config = config;
        this.extractor = new WindowExtractor(config.getInterval(), config.getMinEntries());
        this.estimator = new EmpiricalQuantile(config.getCdfLower(), config.getCdfUpper(), config.getBuffer());
        this.classifier = new SpikeClassifier();
        this.listener = listener == null ? NoopDiagnosticListener.INSTANCE : listener;
    }

    /**
     * 运行扫描
     */
    public ScanResult scan(SampleSeries series) {
        logger.info("开始扫描: {} 行, {}", series.size(), config);

        int n = series.size();
        boolean[] truth = series.groundTruth(config.getBuffer());
        LabelBuffer labels = new LabelBuffer(n);
        boolean[] evaluated = new boolean[n];
        int warmUp = 0;
        int skipped = 0;
        int flagged = 0;

        for (int i = 0; i < n; i++) {
            if (cancelled.get()) {
                logger.warn("扫描已取消: 停止于第 {} 行", i);
                break;
            }

            // 预热期不评估
            if (extractor.isWarmUp(i)) {
                labels.write(i, false);
                warmUp++;
                continue;
            }

            Sample point = series.get(i);
            SampleWindow window = extractor.extract(series, i);
            if (!extractor.hasEnoughEntries(window)) {
                logger.info("第 {} 行 {}: 窗口内仅 {} 个有效值，跳过", i, point.getTime(), window.getValidCount());
                labels.write(i, false);
                skipped++;
                continue;
            }

            Optional<EmpiricalDistribution> distribution =
                    EmpiricalDistribution.build(window, labels.view(), config.getNbins());
            if (distribution.isEmpty()) {
                logger.info("第 {} 行 {}: 排除已识别尖峰后无可用值，跳过", i, point.getTime());
                labels.write(i, false);
                skipped++;
                continue;
            }

            ConfidenceInterval interval = estimator.estimate(distribution.get());
            boolean spike = classifier.classify(labels, i, point.getRaw(), interval);
            evaluated[i] = true;
            if (spike) {
                flagged++;
            }

            if (spike || truth[i]) {
                notifyListener(new DiagnosticEvent(i, point, window, windowLabels(labels, window),
                        interval, spike, truth[i]));
            }
        }

        ScanResult result = new ScanResult(labels.toArray(), evaluated, labels.finalizedCount(),
                warmUp, skipped, flagged, labels.finalizedCount() < n);
        logger.info("扫描完成: 判定 {} 行, 尖峰 {} 个, 跳过 {} 行",
                result.getEvaluatedCount(), flagged, skipped);
        return result;
    }

    /**
     * 请求停止扫描，已完成的标签保持有效
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public DetectorConfig getConfig() {
        return config;
    }

    private boolean[] windowLabels(LabelBuffer labels, SampleWindow window) {
        boolean[] history = new boolean[window.size()];
        for (int offset = 0; offset < history.length; offset++) {
            history[offset] = labels.read(window.indexOf(offset));
        }
        return history;
    }

    private void notifyListener(DiagnosticEvent event) {
        try {
            listener.onDiagnostic(event);
        } catch (RuntimeException e) {
            logger.warn("诊断回调失败: 第 {} 行 {}", event.getIndex(), e.getMessage());
        }
    }
}
