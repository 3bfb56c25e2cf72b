package com.bomengine.dto;

public enum PredictiveSeverity {
    CRITICAL,
    WARNING
}
