package com.tide.qc.diagnostic;

/**
 * No-op implementation.
 */
public final class NoopDiagnosticListener implements SpikeDiagnosticListener {

    public static final NoopDiagnosticListener INSTANCE = new NoopDiagnosticListener();

    private NoopDiagnosticListener() {
    }
}
