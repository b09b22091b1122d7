package com.tide.qc.diagnostic;

import com.tide.qc.core.ConfigManager;

/**
 * Factory for spike diagnostic listener.
 */
public final class DiagnosticListenerFactory {

    private DiagnosticListenerFactory() {
    }

    public static SpikeDiagnosticListener fromConfig(ConfigManager cfg) {
        boolean enabled = cfg.getBooleanProperty("diagnostics.enabled", true);
        if (!enabled) {
            return NoopDiagnosticListener.INSTANCE;
        }
        int capacity = cfg.getIntProperty("diagnostics.queue.capacity", 1024);
        return new AsyncDiagnosticDispatcher(new LoggingDiagnosticListener(), capacity);
    }
}
