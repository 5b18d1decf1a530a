package com.itq.formledger.dto;

final class HexPatterns {
    static final String ADDRESS = "^[0-9a-fA-F]{64}$";
    static final String HASH = "^[0-9a-fA-F]{64}$";
    static final String SIGNATURE = "^[0-9a-fA-F]{128}$";

    private HexPatterns() {
    }
}
