package com.bomengine.dto;

public enum ReorderPriority {
    URGENT,
    SOON,
    NORMAL
}
