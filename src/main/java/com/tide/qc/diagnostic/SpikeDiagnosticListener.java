package com.tide.qc.diagnostic;

/**
 * 尖峰诊断监听
 * 点被判为尖峰或与真实标签不一致时回调，只做观察，不影响检测状态
 */
public interface SpikeDiagnosticListener {

    default void onDiagnostic(DiagnosticEvent event) {
    }

    /**
     * Release resources.
     */
    default void close() {
    }
}
