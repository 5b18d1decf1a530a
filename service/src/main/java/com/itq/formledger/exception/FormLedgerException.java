package com.itq.formledger.exception;

/**
 * Rejection of an operation before any state change is committed.
 * Each {@link ErrorCode} corresponds to exactly one failed precondition.
 */
public class FormLedgerException extends RuntimeException {

    private final ErrorCode code;

    public FormLedgerException(ErrorCode code) {
        super(code.getDescription());
        this.code = code;
    }

    public FormLedgerException(ErrorCode code, String detail) {
        super(code.getDescription() + ": " + detail);
        this.code = code;
    }

    public FormLedgerException(ErrorCode code, String detail, Throwable cause) {
        super(code.getDescription() + ": " + detail, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
