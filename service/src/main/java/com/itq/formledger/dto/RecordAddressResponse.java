package com.itq.formledger.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RecordAddressResponse {
    private String documentId;
    private String programId;
    private String address;
    private int bump;
}
