package com.cleanwater.backend.modules.audit.application;

/**
 * Action names written to {@code audit_logs.action}.
 */
public final class AuditAction {

    public static final String USER_REGISTER = "user_register";
    public static final String USER_LOGIN = "user_login";
    public static final String USER_LOGOUT = "user_logout";
    public static final String TOKEN_REFRESH = "token_refresh";
    public static final String TWO_FACTOR_ENABLE = "2fa_enable";
    public static final String TWO_FACTOR_DISABLE = "2fa_disable";
    public static final String ROLE_UPDATE = "role_update";
    public static final String USER_ASSIGN = "user_assign";
    public static final String API_KEY_CREATE = "api_key_create";
    public static final String API_KEY_VALIDATE = "api_key_validate";
    public static final String API_KEY_REVOKE = "api_key_revoke";
    public static final String SENSOR_HEARTBEAT = "sensor_heartbeat";
    public static final String ALLOWED_EMAIL_CREATE = "allowed_email_create";
    public static final String ALLOWED_EMAIL_DELETE = "allowed_email_delete";

    private AuditAction() {
    }
}
