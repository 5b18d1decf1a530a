package com.itq.formledger.repository;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateKeysTest {

    @Test
    void uniqueViolationDeepInCauseChain_isDuplicate() {
        SQLException sql = new SQLException("duplicate key value violates unique constraint", "23505");
        DataIntegrityViolationException ex = new DataIntegrityViolationException("could not execute statement",
                new RuntimeException("constraint violation", sql));

        assertThat(DuplicateKeys.isDuplicateKey(ex)).isTrue();
    }

    @Test
    void springDuplicateKeyException_isDuplicate() {
        assertThat(DuplicateKeys.isDuplicateKey(new DuplicateKeyException("dup"))).isTrue();
    }

    @Test
    void encodingAndLengthViolations_areNotDuplicates() {
        assertThat(DuplicateKeys.isDuplicateKey(new DataIntegrityViolationException("nul byte",
                new SQLException("invalid byte sequence", "22021")))).isFalse();
        assertThat(DuplicateKeys.isDuplicateKey(new DataIntegrityViolationException("too long",
                new SQLException("value too long", "22001")))).isFalse();
        assertThat(DuplicateKeys.isDuplicateKey(new DataIntegrityViolationException("no cause"))).isFalse();
    }
}
