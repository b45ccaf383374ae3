package com.notifywheel.model.enums;

/**
 * 告警级别
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
