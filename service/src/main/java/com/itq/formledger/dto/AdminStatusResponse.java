package com.itq.formledger.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AdminStatusResponse {
    private String address;
    private boolean admin;
}
