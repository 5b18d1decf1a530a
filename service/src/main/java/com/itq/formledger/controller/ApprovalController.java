package com.itq.formledger.controller;

import com.itq.formledger.addressing.AddressDerivation;
import com.itq.formledger.addressing.DerivedAddress;
import com.itq.formledger.domain.Address;
import com.itq.formledger.domain.FormHash;
import com.itq.formledger.dto.*;
import com.itq.formledger.security.CallerAuthenticator;
import com.itq.formledger.security.InstructionMessage;
import com.itq.formledger.service.ApprovalRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Document ids travel in request bodies and query parameters, never in the path,
 * so every id the registry accepts can be looked up again.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalRegistryService approvalRegistryService;
    private final CallerAuthenticator authenticator;
    private final AddressDerivation derivation;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApprovalDetailsResponse signFormSubmission(@Valid @RequestBody SignFormRequest req) {
        FormHash hash = FormHash.fromHex(req.getDocumentHash());
        Address caller = authenticator.authenticate(req.getCaller(), req.getSignature(),
                InstructionMessage.of(derivation.getProgramId(), InstructionMessage.SIGN_FORM_SUBMISSION, req.getNonce())
                        .arg(req.getDocumentId())
                        .arg(hash.toHex())
                        .arg(req.getMetadata()));
        return approvalRegistryService.signFormSubmission(caller, req.getDocumentId(), hash, req.getMetadata());
    }

    @PutMapping("/metadata")
    public ApprovalDetailsResponse updateFormApproval(@Valid @RequestBody UpdateMetadataRequest req) {
        Address caller = authenticator.authenticate(req.getCaller(), req.getSignature(),
                InstructionMessage.of(derivation.getProgramId(), InstructionMessage.UPDATE_FORM_APPROVAL, req.getNonce())
                        .arg(req.getDocumentId())
                        .arg(req.getMetadata()));
        return approvalRegistryService.updateFormApproval(caller, req.getDocumentId(), req.getMetadata());
    }

    @GetMapping("/verify")
    public VerificationResponse verifyFormApproval(@RequestParam("documentId") String documentId,
                                                   @RequestParam("hash") String hash) {
        boolean valid = approvalRegistryService.verifyFormApproval(documentId, FormHash.fromHex(hash));
        return new VerificationResponse(documentId, valid);
    }

    @GetMapping
    public ApprovalDetailsResponse getFormApprovalDetails(@RequestParam("documentId") String documentId) {
        return approvalRegistryService.getFormApprovalDetails(documentId);
    }

    @GetMapping("/history")
    public List<LedgerEventResponse> getHistory(@RequestParam("documentId") String documentId) {
        return approvalRegistryService.getHistory(documentId);
    }

    /** Derives where the record for {@code documentId} lives, without reading storage. */
    @GetMapping("/address")
    public RecordAddressResponse deriveAddress(@RequestParam("documentId") String documentId) {
        DerivedAddress derived = approvalRegistryService.addressOf(documentId);
        return new RecordAddressResponse(documentId, derivation.getProgramId().toHex(),
                derived.getAddress().toHex(), derived.getBump());
    }
}
