package com.hubhrms.onboarding.entity;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
