package com.itq.formledger.service;

import com.itq.formledger.addressing.AddressDerivation;
import com.itq.formledger.addressing.DerivedAddress;
import com.itq.formledger.domain.Address;
import com.itq.formledger.dto.AdminRegistryResponse;
import com.itq.formledger.entity.AdminConfig;
import com.itq.formledger.entity.LedgerAction;
import com.itq.formledger.exception.ErrorCode;
import com.itq.formledger.exception.FormLedgerException;
import com.itq.formledger.repository.AdminConfigRepository;
import com.itq.formledger.repository.DuplicateKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the singleton admin registry: the authority and the bounded set of
 * admins allowed to approve forms. Each mutation is one transaction holding a
 * write lock on the registry row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminRegistryService {

    private final AdminConfigRepository configRepository;
    private final AddressDerivation derivation;
    private final LedgerHistoryService history;
    private final LedgerMapper mapper;

    // ── Initialize ────────────────────────────────────────────────────────────

    @Transactional
    public AdminRegistryResponse initialize(Address caller) {
        requireCaller(caller);
        DerivedAddress derived = derivation.adminConfigAddress();
        String key = derived.getAddress().toHex();
        if (configRepository.existsById(key)) {
            throw new FormLedgerException(ErrorCode.ALREADY_INITIALIZED, key);
        }

        AdminConfig config = new AdminConfig();
        config.setAddress(key);
        config.setAuthority(caller);
        config.setBump(derived.getBump());
        config.appendAdmin(caller);

        // a concurrent initializer that won the race shows up as a primary key collision
        try {
            configRepository.saveAndFlush(config);
        } catch (DataIntegrityViolationException e) {
            if (DuplicateKeys.isDuplicateKey(e)) {
                throw new FormLedgerException(ErrorCode.ALREADY_INITIALIZED, key, e);
            }
            throw e;
        }

        history.record(derived.getAddress(), LedgerAction.INITIALIZED, caller, caller.toHex(), null);
        log.info("Admin config initialized with authority: {}", caller);
        return mapper.toResponse(config);
    }

    // ── Add / remove ──────────────────────────────────────────────────────────

    @Transactional
    public AdminRegistryResponse addAdmin(Address caller, Address newAdmin) {
        requireCaller(caller);
        AdminConfig config = loadForUpdate();
        requireAuthority(config, caller);
        if (newAdmin == null || newAdmin.isZero()) {
            throw new IllegalArgumentException("New admin must be a non-zero address");
        }

        if (config.isFull()) {
            throw new FormLedgerException(ErrorCode.MAX_ADMINS_REACHED,
                    "limit is " + AdminConfig.MAX_ADMINS);
        }
        if (config.isAdmin(newAdmin)) {
            throw new FormLedgerException(ErrorCode.ADMIN_ALREADY_EXISTS, newAdmin.toHex());
        }

        config.appendAdmin(newAdmin);
        history.record(Address.fromHex(config.getAddress()), LedgerAction.ADMIN_ADDED,
                caller, newAdmin.toHex(), "admin_count=" + config.getAdminCount());
        log.info("New admin added: {} (count={})", newAdmin, config.getAdminCount());
        return mapper.toResponse(config);
    }

    @Transactional
    public AdminRegistryResponse removeAdmin(Address caller, Address target) {
        requireCaller(caller);
        AdminConfig config = loadForUpdate();
        requireAuthority(config, caller);

        // evaluated on the total count so the set can never be emptied, whoever the target is
        if (config.getAdminCount() <= 1) {
            throw new FormLedgerException(ErrorCode.CANNOT_REMOVE_LAST_ADMIN);
        }
        if (target == null || !config.isAdmin(target)) {
            throw new FormLedgerException(ErrorCode.ADMIN_NOT_FOUND, String.valueOf(target));
        }

        config.removeAdmin(target);
        history.record(Address.fromHex(config.getAddress()), LedgerAction.ADMIN_REMOVED,
                caller, target.toHex(), "admin_count=" + config.getAdminCount());
        log.info("Admin removed: {} (count={})", target, config.getAdminCount());
        return mapper.toResponse(config);
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public AdminRegistryResponse getRegistry() {
        String key = derivation.adminConfigAddress().getAddress().toHex();
        return configRepository.findById(key)
                .map(mapper::toResponse)
                .orElseThrow(() -> new FormLedgerException(ErrorCode.NOT_INITIALIZED));
    }

    /** True iff {@code address} is currently an admin. An uninitialized registry has no admins. */
    @Transactional(readOnly = true)
    public boolean isAdmin(Address address) {
        if (address == null) {
            return false;
        }
        String key = derivation.adminConfigAddress().getAddress().toHex();
        return configRepository.findById(key)
                .map(config -> config.isAdmin(address))
                .orElse(false);
    }

    /**
     * Authorization check for approval operations. Holds a shared lock on the
     * registry until the caller's transaction ends, so membership cannot change
     * underneath an approval in flight.
     */
    @Transactional
    public void requireAdmin(Address caller) {
        String key = derivation.adminConfigAddress().getAddress().toHex();
        AdminConfig config = configRepository.findByIdForShare(key)
                .orElseThrow(() -> new FormLedgerException(ErrorCode.NOT_INITIALIZED));
        if (caller == null || !config.isAdmin(caller)) {
            throw new FormLedgerException(ErrorCode.UNAUTHORIZED_ADMIN, String.valueOf(caller));
        }
    }

    private AdminConfig loadForUpdate() {
        String key = derivation.adminConfigAddress().getAddress().toHex();
        return configRepository.findByIdForUpdate(key)
                .orElseThrow(() -> new FormLedgerException(ErrorCode.NOT_INITIALIZED));
    }

    private static void requireAuthority(AdminConfig config, Address caller) {
        if (!config.getAuthority().equals(caller)) {
            throw new FormLedgerException(ErrorCode.UNAUTHORIZED_ADMIN, caller.toHex());
        }
    }

    private static void requireCaller(Address caller) {
        if (caller == null || caller.isZero()) {
            throw new FormLedgerException(ErrorCode.UNAUTHORIZED_ADMIN, "missing caller");
        }
    }
}
