package com.visionai.gateway.database.registry;

import java.util.Locale;

/**
 * Lifecycle state of a database handle, driven by backend connection events.
 *
 * <pre>
 *   CONNECTING ──ping ok / server up──▶ CONNECTED ──server lost──▶ DISCONNECTED
 *                                          ▲                            │
 *                                          └────────server back─────────┘
 *   any ──close()──▶ DISCONNECTING ──▶ DISCONNECTED (terminal)
 * </pre>
 */
public enum ReadyState {

    DISCONNECTED,
    CONNECTED,
    CONNECTING,
    DISCONNECTING;

    /** Lower-case name used in status documents, e.g. {@code "connected"}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
