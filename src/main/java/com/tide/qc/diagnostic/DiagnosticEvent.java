package com.tide.qc.diagnostic;

import com.tide.qc.core.Sample;
import com.tide.qc.statistics.ConfidenceInterval;
import com.tide.qc.statistics.SampleWindow;

/**
 * Snapshot of one classified point handed to diagnostic listeners.
 * Label history is a copy, so listeners never observe later writes.
 */
public class DiagnosticEvent {

    private final int index;
    private final Sample point;
    private final SampleWindow window;
    private final boolean[] labelHistory;
    private final ConfidenceInterval interval;
    private final boolean predictedSpike;
    private final boolean trueSpike;

    public DiagnosticEvent(int index, Sample point, SampleWindow window, boolean[] labelHistory,
                           ConfidenceInterval interval, boolean predictedSpike, boolean trueSpike) {
        this.index = index;
        this.point = point;
        this.window = window;
        this.labelHistory = labelHistory.clone();
        this.interval = interval;
        this.predictedSpike = predictedSpike;
        this.trueSpike = trueSpike;
    }

    public int getIndex() { return index; }
    public Sample getPoint() { return point; }
    public SampleWindow getWindow() { return window; }
    public ConfidenceInterval getInterval() { return interval; }
    public boolean isPredictedSpike() { return predictedSpike; }
    public boolean isTrueSpike() { return trueSpike; }

    /**
     * Labels for the window range, aligned with {@link SampleWindow#getSamples()}.
     */
    public boolean[] getLabelHistory() {
        return labelHistory.clone();
    }

    public int getSpikesInWindow() {
        int spikes = 0;
        for (boolean label : labelHistory) {
            if (label) {
                spikes++;
            }
        }
        return spikes;
    }

    public boolean isMisclassified() {
        return predictedSpike != trueSpike;
    }
}
