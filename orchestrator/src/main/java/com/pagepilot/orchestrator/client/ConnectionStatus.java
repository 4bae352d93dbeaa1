package com.pagepilot.orchestrator.client;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Derived from the most recent plan request or health probe; never set directly. */
public enum ConnectionStatus {
    DISCONNECTED, CONNECTING, CONNECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
