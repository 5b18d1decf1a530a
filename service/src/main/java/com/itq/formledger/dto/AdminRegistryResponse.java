package com.itq.formledger.dto;

import lombok.Data;

import java.util.List;

@Data
public class AdminRegistryResponse {
    private String address;
    private int bump;
    private String authority;
    private List<String> admins;
    private int adminCount;
}
