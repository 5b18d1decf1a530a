package com.itq.formledger.service;

import com.itq.formledger.domain.Address;
import com.itq.formledger.entity.CallerNonce;
import com.itq.formledger.exception.ErrorCode;
import com.itq.formledger.exception.FormLedgerException;
import com.itq.formledger.repository.CallerNonceRepository;
import com.itq.formledger.repository.DuplicateKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Per-caller request sequence. A caller's first signed request carries nonce 0,
 * every accepted one advances it by one. A nonce is consumed as soon as its
 * signature is accepted, whether or not the operation it authorizes succeeds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallerNonceService {

    private final CallerNonceRepository nonceRepository;

    @Transactional(readOnly = true)
    public long nextNonce(Address caller) {
        return nonceRepository.findById(caller.toHex())
                .map(CallerNonce::getNextNonce)
                .orElse(0L);
    }

    /**
     * Accepts {@code nonce} only if it is the caller's next expected value.
     *
     * @throws FormLedgerException with {@link ErrorCode#INVALID_SIGNATURE} for a reused or out-of-order nonce
     */
    @Transactional
    public void consume(Address caller, long nonce) {
        String key = caller.toHex();
        Optional<CallerNonce> stored = nonceRepository.findByIdForUpdate(key);
        long expected = stored.map(CallerNonce::getNextNonce).orElse(0L);
        if (nonce != expected) {
            log.warn("Rejected nonce {} from {}, expected {}", nonce, caller, expected);
            throw new FormLedgerException(ErrorCode.INVALID_SIGNATURE,
                    "nonce " + nonce + " is stale or out of order, expected " + expected);
        }

        if (stored.isPresent()) {
            stored.get().setNextNonce(expected + 1);
            return;
        }
        CallerNonce first = new CallerNonce();
        first.setCaller(key);
        first.setNextNonce(1);
        // two first requests racing: the loser collides on the key
        try {
            nonceRepository.saveAndFlush(first);
        } catch (DataIntegrityViolationException e) {
            if (DuplicateKeys.isDuplicateKey(e)) {
                throw new FormLedgerException(ErrorCode.INVALID_SIGNATURE, "nonce 0 already used", e);
            }
            throw e;
        }
    }
}
