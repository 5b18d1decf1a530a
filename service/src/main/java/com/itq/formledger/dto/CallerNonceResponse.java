package com.itq.formledger.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CallerNonceResponse {
    private String caller;
    private long nextNonce;
}
