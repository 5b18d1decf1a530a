package com.itq.formledger.controller;

import com.itq.formledger.domain.Address;
import com.itq.formledger.dto.CallerNonceResponse;
import com.itq.formledger.service.CallerNonceService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/callers")
@RequiredArgsConstructor
public class CallerController {

    private final CallerNonceService callerNonceService;

    /** The nonce the caller must sign into its next request. */
    @GetMapping("/{address}/nonce")
    public CallerNonceResponse nextNonce(@PathVariable("address") String address) {
        Address caller = Address.fromHex(address);
        return new CallerNonceResponse(caller.toHex(), callerNonceService.nextNonce(caller));
    }
}
