package com.phillippitts.hazardscan.domain;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
