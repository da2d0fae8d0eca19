package com.bbthechange.mobilelogin.model;

/**
 * Kinds of append-only audit records. Each kind lives in its own table.
 */
public enum AuditEventKind {
    CONNECT("ConnectEvents"),
    DEVICE_INFO("DeviceInfoEvents"),
    CONNECTION_ERROR("ConnectionErrorEvents"),
    LOGIN("LoginEvents"),
    OTP_VERIFICATION("OtpVerificationEvents"),
    PROFILE("ProfileEvents"),
    LANGUAGE("LanguageEvents");

    private final String tableName;

    AuditEventKind(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
