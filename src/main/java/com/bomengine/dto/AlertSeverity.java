package com.bomengine.dto;

/**
 * Declared worst first; ordinal order is the sort order of active alerts.
 */
public enum AlertSeverity {
    OUT_OF_STOCK,
    CRITICAL,
    LOW
}
