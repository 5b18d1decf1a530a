package com.itq.formledger.entity;

public enum LedgerAction {
    INITIALIZED,
    ADMIN_ADDED,
    ADMIN_REMOVED,
    FORM_APPROVED,
    METADATA_UPDATED
}
