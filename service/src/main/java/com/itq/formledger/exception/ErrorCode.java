package com.itq.formledger.exception;

public enum ErrorCode {
    ALREADY_INITIALIZED("Admin registry is already initialized"),
    NOT_INITIALIZED("Admin registry is not initialized"),
    UNAUTHORIZED_ADMIN("Unauthorized admin"),
    ADMIN_ALREADY_EXISTS("Admin already exists"),
    ADMIN_NOT_FOUND("Admin not found"),
    MAX_ADMINS_REACHED("Maximum number of admins reached"),
    CANNOT_REMOVE_LAST_ADMIN("Cannot remove the last admin"),
    EMPTY_FORM_ID("Form ID must not be empty"),
    FORM_ID_TOO_LONG("Form ID is too long"),
    METADATA_TOO_LONG("Metadata is too long"),
    INVALID_FORM_HASH("Invalid form hash"),
    FORM_ALREADY_APPROVED("Form already approved"),
    RECORD_NOT_FOUND("Approval record not found"),
    INVALID_SIGNATURE("Caller signature is missing or invalid");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
