package com.itq.formledger.dto;

import com.itq.formledger.entity.LedgerAction;
import lombok.Data;

@Data
public class LedgerEventResponse {
    private Long id;
    private LedgerAction action;
    private String actor;
    private String subject;
    private long recordedAt;
    private String detail;
}
