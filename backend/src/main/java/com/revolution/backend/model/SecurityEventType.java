package com.revolution.backend.model;

import java.util.Locale;

public enum SecurityEventType {
    LOGIN,
    LOGIN_FAILED,
    LOGIN_MFA_REQUIRED,
    MFA_CODE_FAILED,
    MFA_BACKUP_CODE_USED,
    MFA_BACKUP_CODE_FAILED,
    MFA_SETUP_INITIATED,
    MFA_ENABLED,
    MFA_DISABLED,
    BACKUP_CODES_REGENERATED,
    LOGOUT,
    LOGOUT_ALL,
    TOKEN_REFRESHED,
    PASSWORD_CHANGED,
    ACCOUNT_LOCKED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
