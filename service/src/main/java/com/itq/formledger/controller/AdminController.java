package com.itq.formledger.controller;

import com.itq.formledger.addressing.AddressDerivation;
import com.itq.formledger.domain.Address;
import com.itq.formledger.dto.AdminChangeRequest;
import com.itq.formledger.dto.AdminRegistryResponse;
import com.itq.formledger.dto.AdminStatusResponse;
import com.itq.formledger.dto.InitializeRequest;
import com.itq.formledger.security.CallerAuthenticator;
import com.itq.formledger.security.InstructionMessage;
import com.itq.formledger.service.AdminRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminRegistryService adminRegistryService;
    private final CallerAuthenticator authenticator;
    private final AddressDerivation derivation;

    @PostMapping("/initialize")
    @ResponseStatus(HttpStatus.CREATED)
    public AdminRegistryResponse initialize(@Valid @RequestBody InitializeRequest req) {
        Address caller = authenticator.authenticate(req.getCaller(), req.getSignature(),
                InstructionMessage.of(derivation.getProgramId(), InstructionMessage.INITIALIZE, req.getNonce()));
        return adminRegistryService.initialize(caller);
    }

    @GetMapping
    public AdminRegistryResponse getRegistry() {
        return adminRegistryService.getRegistry();
    }

    @GetMapping("/members/{address}")
    public AdminStatusResponse isAdmin(@PathVariable("address") String address) {
        Address candidate = Address.fromHex(address);
        return new AdminStatusResponse(candidate.toHex(), adminRegistryService.isAdmin(candidate));
    }

    @PostMapping("/members")
    public AdminRegistryResponse addAdmin(@Valid @RequestBody AdminChangeRequest req) {
        Address admin = Address.fromHex(req.getAdmin());
        Address caller = authenticator.authenticate(req.getCaller(), req.getSignature(),
                InstructionMessage.of(derivation.getProgramId(), InstructionMessage.ADD_ADMIN, req.getNonce())
                        .arg(admin.toHex()));
        return adminRegistryService.addAdmin(caller, admin);
    }

    @PostMapping("/members/remove")
    public AdminRegistryResponse removeAdmin(@Valid @RequestBody AdminChangeRequest req) {
        Address admin = Address.fromHex(req.getAdmin());
        Address caller = authenticator.authenticate(req.getCaller(), req.getSignature(),
                InstructionMessage.of(derivation.getProgramId(), InstructionMessage.REMOVE_ADMIN, req.getNonce())
                        .arg(admin.toHex()));
        return adminRegistryService.removeAdmin(caller, admin);
    }
}
