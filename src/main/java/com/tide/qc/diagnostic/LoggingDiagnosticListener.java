package com.tide.qc.diagnostic;

import com.tide.qc.core.Sample;
import com.tide.qc.statistics.SampleWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 诊断日志：逐点输出窗口范围、置信区间与判定结果
 */
public class LoggingDiagnosticListener implements SpikeDiagnosticListener {

    private static final Logger DIAGNOSTIC_LOGGER = LoggerFactory.getLogger("DIAGNOSTIC_LOGGER");

    @Override
    public void onDiagnostic(DiagnosticEvent event) {
        Sample point = event.getPoint();
        SampleWindow window = event.getWindow();
        DIAGNOSTIC_LOGGER.info(
                "\n+------------------------------------------\n"
                        + "| {}-th row: {} ...\n"
                        + "|      selected row index: {} - {}\n"
                        + "|      last {} rows has {} spikes\n"
                        + "|      histogram limits are {} - {}\n"
                        + "|      this point is {}; is spike? {}\n"
                        + "|      Is this really a spike? {} ({}).",
                event.getIndex(), point.getTime(),
                window.getFromIndex(), window.getToIndex() - 1,
                window.size(), event.getSpikesInWindow(),
                round5(event.getInterval().getLower()), round5(event.getInterval().getUpper()),
                round5(point.getRaw()), event.isPredictedSpike(),
                event.isTrueSpike(), point.getDelta());
    }

    private static String round5(double value) {
        return String.format("%.5f", value);
    }
}
