package com.omniguard.core.domain;

public enum AuditEventType {
    RECORDED,
    QUOTA_DENIED,
    CONTENT_BLOCKED,
    CRISIS_FLAGGED,
    ENCRYPTION_FAILED,
    DECRYPT_FAILED,
    KEY_ROTATED,
    AUDIT_UNFROZEN
}
