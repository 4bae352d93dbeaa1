package com.pagepilot.orchestrator.model;

/**
 * The four low-level actions a plan step can perform.
 * The enum name is the {@code tool} tag on the wire.
 */
public enum Tool {
    CLICK,
    TYPE,
    SCROLL,
    NAVIGATE
}
