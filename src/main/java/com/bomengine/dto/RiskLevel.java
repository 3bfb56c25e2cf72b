package com.bomengine.dto;

public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW
}
