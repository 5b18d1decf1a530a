package com.itq.formledger.service;

import com.itq.formledger.addressing.AddressDerivation;
import com.itq.formledger.addressing.DerivedAddress;
import com.itq.formledger.domain.Address;
import com.itq.formledger.domain.FormHash;
import com.itq.formledger.dto.ApprovalDetailsResponse;
import com.itq.formledger.dto.LedgerEventResponse;
import com.itq.formledger.entity.FormApproval;
import com.itq.formledger.entity.LedgerAction;
import com.itq.formledger.exception.ErrorCode;
import com.itq.formledger.exception.FormLedgerException;
import com.itq.formledger.exception.RecordNotFoundException;
import com.itq.formledger.repository.DuplicateKeys;
import com.itq.formledger.repository.FormApprovalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * One approval record per document id. The record lives at the address derived
 * from the id, so a second approval of the same id targets an occupied key and
 * is rejected. Only {@code metadata} changes after creation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalRegistryService {

    private final FormApprovalRepository approvalRepository;
    private final AdminRegistryService adminRegistry;
    private final AddressDerivation derivation;
    private final LedgerHistoryService history;
    private final LedgerMapper mapper;
    private final Clock clock;

    // ── Sign ──────────────────────────────────────────────────────────────────

    @Transactional
    public ApprovalDetailsResponse signFormSubmission(Address caller, String documentId,
                                                      FormHash documentHash, String metadata) {
        validateFormId(documentId);
        if (documentHash == null || documentHash.isZero()) {
            throw new FormLedgerException(ErrorCode.INVALID_FORM_HASH);
        }
        adminRegistry.requireAdmin(caller);
        if (metadata != null) {
            validateMetadata(metadata);
        }

        DerivedAddress derived = derivation.formApprovalAddress(documentId);
        String key = derived.getAddress().toHex();
        if (approvalRepository.existsById(key)) {
            throw new FormLedgerException(ErrorCode.FORM_ALREADY_APPROVED, documentId);
        }

        FormApproval approval = new FormApproval();
        approval.setAddress(key);
        approval.setDocumentId(documentId);
        approval.setDocumentHash(documentHash);
        approval.setSigner(caller);
        approval.setApprovedAt(clock.instant().getEpochSecond());
        approval.setMetadata(metadata == null ? "" : metadata);
        approval.setBump(derived.getBump());

        // insert-if-absent: losing a creation race surfaces as a key collision at flush
        try {
            approvalRepository.saveAndFlush(approval);
        } catch (DataIntegrityViolationException e) {
            if (DuplicateKeys.isDuplicateKey(e)) {
                throw new FormLedgerException(ErrorCode.FORM_ALREADY_APPROVED, documentId, e);
            }
            throw e;
        }

        history.record(derived.getAddress(), LedgerAction.FORM_APPROVED, caller, documentId,
                "hash=" + documentHash.toHex());
        log.info("Form {} approved by admin {} at timestamp {}",
                documentId, caller, approval.getApprovedAt());
        return mapper.toResponse(approval);
    }

    // ── Update ────────────────────────────────────────────────────────────────

    @Transactional
    public ApprovalDetailsResponse updateFormApproval(Address caller, String documentId, String metadata) {
        Objects.requireNonNull(metadata, "metadata");
        DerivedAddress derived = addressOf(documentId);
        FormApproval approval = approvalRepository.findByIdForUpdate(derived.getAddress().toHex())
                .orElseThrow(() -> new RecordNotFoundException(documentId));

        if (caller == null || !approval.getSigner().equals(caller)) {
            throw new FormLedgerException(ErrorCode.UNAUTHORIZED_ADMIN, "not the original signer");
        }
        // the signer must also still hold admin rights
        adminRegistry.requireAdmin(caller);
        validateMetadata(metadata);

        approval.setMetadata(metadata);
        history.record(derived.getAddress(), LedgerAction.METADATA_UPDATED, caller, documentId, null);
        log.info("Form {} approval metadata updated by admin: {}", documentId, caller);
        return mapper.toResponse(approval);
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    /**
     * Compares {@code expectedHash} with the stored digest in constant time.
     *
     * @throws RecordNotFoundException if no record exists for {@code documentId}
     */
    @Transactional(readOnly = true)
    public boolean verifyFormApproval(String documentId, FormHash expectedHash) {
        FormApproval approval = load(documentId);
        boolean valid = approval.getDocumentHash().matches(expectedHash);
        log.debug("Form verification result for {}: {}", documentId, valid);
        return valid;
    }

    @Transactional(readOnly = true)
    public ApprovalDetailsResponse getFormApprovalDetails(String documentId) {
        return mapper.toResponse(load(documentId));
    }

    @Transactional(readOnly = true)
    public List<LedgerEventResponse> getHistory(String documentId) {
        FormApproval approval = load(documentId);
        return history.eventsFor(Address.fromHex(approval.getAddress())).stream()
                .map(mapper::toResponse)
                .toList();
    }

    public DerivedAddress addressOf(String documentId) {
        if (documentId == null) {
            throw new RecordNotFoundException("null");
        }
        return derivation.formApprovalAddress(documentId);
    }

    private FormApproval load(String documentId) {
        String key = addressOf(documentId).getAddress().toHex();
        return approvalRepository.findById(key)
                .orElseThrow(() -> new RecordNotFoundException(documentId));
    }

    private static void validateFormId(String documentId) {
        if (documentId == null || documentId.isEmpty()) {
            throw new FormLedgerException(ErrorCode.EMPTY_FORM_ID);
        }
        int length = documentId.getBytes(StandardCharsets.UTF_8).length;
        if (length > FormApproval.MAX_FORM_ID_LENGTH) {
            throw new FormLedgerException(ErrorCode.FORM_ID_TOO_LONG,
                    length + " bytes, limit is " + FormApproval.MAX_FORM_ID_LENGTH);
        }
    }

    private static void validateMetadata(String metadata) {
        int length = metadata.getBytes(StandardCharsets.UTF_8).length;
        if (length > FormApproval.MAX_METADATA_LENGTH) {
            throw new FormLedgerException(ErrorCode.METADATA_TOO_LONG,
                    length + " bytes, limit is " + FormApproval.MAX_METADATA_LENGTH);
        }
    }
}
