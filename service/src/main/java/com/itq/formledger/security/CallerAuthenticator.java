package com.itq.formledger.security;

import com.itq.formledger.domain.Address;
import com.itq.formledger.exception.ErrorCode;
import com.itq.formledger.exception.FormLedgerException;
import com.itq.formledger.service.CallerNonceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.HexFormat;

/**
 * Establishes caller identity. An address is a raw Ed25519 public key; the
 * caller proves it holds the private key by signing the instruction bytes.
 * An accepted signature consumes the nonce it was made over.
 */
@Slf4j
@Component
public class CallerAuthenticator {

    // DER SubjectPublicKeyInfo header for a raw 32-byte Ed25519 key
    private static final byte[] ED25519_SPKI_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");

    private final CallerNonceService nonces;
    private final boolean verifySignatures;

    public CallerAuthenticator(CallerNonceService nonces,
                               @Value("${formledger.auth.verify-signatures:true}") boolean verifySignatures) {
        this.nonces = nonces;
        this.verifySignatures = verifySignatures;
        if (!verifySignatures) {
            log.warn("Caller signature verification is DISABLED; callers are trusted as declared");
        }
    }

    /**
     * Returns the caller's address once the signature over {@code message} checks out
     * and its nonce is the caller's next one.
     *
     * @throws FormLedgerException with {@link ErrorCode#INVALID_SIGNATURE} otherwise
     */
    public Address authenticate(String callerHex, String signatureHex, InstructionMessage message) {
        Address caller = Address.fromHex(callerHex);
        if (verifySignatures) {
            verify(caller, signatureHex, message);
        }
        nonces.consume(caller, message.getNonce());
        return caller;
    }

    private void verify(Address caller, String signatureHex, InstructionMessage message) {
        if (signatureHex == null || signatureHex.isBlank()) {
            throw new FormLedgerException(ErrorCode.INVALID_SIGNATURE, "signature missing");
        }
        boolean valid;
        try {
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(toPublicKey(caller));
            verifier.update(message.toBytes());
            valid = verifier.verify(HexFormat.of().parseHex(signatureHex));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Rejected signature from {}: {}", caller, e.getMessage());
            throw new FormLedgerException(ErrorCode.INVALID_SIGNATURE, caller.toHex(), e);
        }
        if (!valid) {
            log.warn("Rejected signature from {}: verification failed", caller);
            throw new FormLedgerException(ErrorCode.INVALID_SIGNATURE, caller.toHex());
        }
    }

    static PublicKey toPublicKey(Address address) throws GeneralSecurityException {
        byte[] raw = address.toBytes();
        byte[] encoded = new byte[ED25519_SPKI_PREFIX.length + raw.length];
        System.arraycopy(ED25519_SPKI_PREFIX, 0, encoded, 0, ED25519_SPKI_PREFIX.length);
        System.arraycopy(raw, 0, encoded, ED25519_SPKI_PREFIX.length, raw.length);
        return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(encoded));
    }
}
