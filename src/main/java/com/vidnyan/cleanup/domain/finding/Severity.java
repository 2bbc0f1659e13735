package com.vidnyan.cleanup.domain.finding;

/**
 * Finding severity levels, lowest first.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
