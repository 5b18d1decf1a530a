package com.itq.formledger.repository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;

/**
 * Tells a primary-key or unique-constraint collision apart from other integrity
 * violations (bad encodings, oversized values). Both H2 and PostgreSQL report
 * collisions with SQLState {@code 23505}.
 */
public final class DuplicateKeys {

    static final String UNIQUE_VIOLATION = "23505";

    private DuplicateKeys() {
    }

    public static boolean isDuplicateKey(DataIntegrityViolationException ex) {
        if (ex instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
