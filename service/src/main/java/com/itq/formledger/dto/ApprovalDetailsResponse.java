package com.itq.formledger.dto;

import lombok.Data;

@Data
public class ApprovalDetailsResponse {
    private String documentId;
    private String documentHash;
    private String signer;
    private long approvedAt;
    private String metadata;
    private String address;
    private int bump;
}
