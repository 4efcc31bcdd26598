package com.ironcage.gateway.audit;

public enum AuditEventType {
    REQUEST_COMPLETED,
    REQUEST_REJECTED,
    REQUEST_FAILED,
    PROVIDER_ATTEMPT_FAILED,
    BUDGET_SOFT_THRESHOLD,
    BUDGET_OVERRUN,
    RESERVATION_EXPIRED
}
