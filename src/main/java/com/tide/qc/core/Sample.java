package com.tide.qc.core;

import java.time.Instant;

/**
 * 水位观测记录
 */
public class Sample {
    private final Instant time;       // 观测时间
    private final double raw;         // 原始水位（可能为 NaN）
    private final double accepted;    // 质控后水位（可能为 NaN）

    public Sample(Instant time, double raw, double accepted) {
        if (time == null) {
            throw new IllegalArgumentException("观测时间不能为空");
        }
        this.time = time;
        this.raw = raw;
        this.accepted = accepted;
    }

    public Instant getTime() { return time; }
    public double getRaw() { return raw; }
    public double getAccepted() { return accepted; }

    /**
     * 质控值与原始值之差 (accepted - raw)
     */
    public double getDelta() {
        return accepted - raw;
    }

    public boolean hasRaw() {
        return Double.isFinite(raw);
    }

    /**
     * 真实尖峰标签：|delta| 超过缓冲容差
     * delta 为 NaN 时比较结果为 false
     */
    public boolean isTrueSpike(double buffer) {
        return Math.abs(getDelta()) > buffer;
    }

    @Override
    public String toString() {
        return String.format("Sample{time=%s, raw=%s, accepted=%s}", time, raw, accepted);
    }
}
