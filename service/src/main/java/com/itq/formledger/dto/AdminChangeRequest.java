package com.itq.formledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class AdminChangeRequest {

    @NotBlank(message = "caller must not be blank")
    @Pattern(regexp = HexPatterns.ADDRESS, message = "caller must be 64 hex characters")
    private String caller;

    @Pattern(regexp = HexPatterns.SIGNATURE, message = "signature must be 128 hex characters")
    private String signature;

    @NotNull(message = "nonce must be present")
    @PositiveOrZero(message = "nonce must not be negative")
    private Long nonce;

    @NotBlank(message = "admin must not be blank")
    @Pattern(regexp = HexPatterns.ADDRESS, message = "admin must be 64 hex characters")
    private String admin;
}
