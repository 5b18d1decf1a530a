package com.itq.formledger.exception;

public class RecordNotFoundException extends FormLedgerException {
    public RecordNotFoundException(String documentId) {
        super(ErrorCode.RECORD_NOT_FOUND, documentId);
    }
}
