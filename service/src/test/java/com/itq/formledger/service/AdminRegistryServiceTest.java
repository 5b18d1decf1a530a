package com.itq.formledger.service;

import com.itq.formledger.addressing.AddressDerivation;
import com.itq.formledger.domain.Address;
import com.itq.formledger.dto.AdminRegistryResponse;
import com.itq.formledger.entity.AdminConfig;
import com.itq.formledger.entity.LedgerAction;
import com.itq.formledger.exception.ErrorCode;
import com.itq.formledger.exception.FormLedgerException;
import com.itq.formledger.repository.AdminConfigRepository;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminRegistryServiceTest {

    private static final AddressDerivation DERIVATION = new AddressDerivation("42".repeat(32));
    private static final String KEY = DERIVATION.adminConfigAddress().getAddress().toHex();

    private static final Address AUTHORITY = addr(1);
    private static final Address BOB = addr(2);
    private static final Address CAROL = addr(3);

    @Mock private AdminConfigRepository configRepository;
    @Mock private LedgerHistoryService history;

    private AdminRegistryService service;

    @BeforeEach
    void setUp() {
        service = new AdminRegistryService(configRepository, DERIVATION, history, new LedgerMapper());
    }

    private static Address addr(int n) {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, (byte) n);
        return Address.of(bytes);
    }

    private static AdminConfig registry(Address authority, Address... others) {
        AdminConfig config = new AdminConfig();
        config.setAddress(KEY);
        config.setAuthority(authority);
        config.setBump(255);
        config.appendAdmin(authority);
        for (Address other : others) {
            config.appendAdmin(other);
        }
        return config;
    }

    private AdminConfig stored(AdminConfig config) {
        when(configRepository.findByIdForUpdate(KEY)).thenReturn(Optional.of(config));
        return config;
    }

    private static void assertRejected(ThrowingCallable call, ErrorCode code) {
        assertThatThrownBy(call)
                .isInstanceOf(FormLedgerException.class)
                .extracting("code")
                .isEqualTo(code);
    }

    // ── initialize ────────────────────────────────────────────────────────────

    @Test
    void initialize_createsRegistryWithCallerAsSoleAdmin() {
        when(configRepository.existsById(KEY)).thenReturn(false);
        when(configRepository.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        AdminRegistryResponse result = service.initialize(AUTHORITY);

        assertThat(result.getAuthority()).isEqualTo(AUTHORITY.toHex());
        assertThat(result.getAdmins()).containsExactly(AUTHORITY.toHex());
        assertThat(result.getAdminCount()).isEqualTo(1);
        assertThat(result.getAddress()).isEqualTo(KEY);
        verify(configRepository).saveAndFlush(argThat(c ->
                c.getAuthority().equals(AUTHORITY) &&
                c.getAdmins().equals(List.of(AUTHORITY)) &&
                c.getBump() == DERIVATION.adminConfigAddress().getBump()
        ));
        verify(history).record(eq(Address.fromHex(KEY)), eq(LedgerAction.INITIALIZED),
                eq(AUTHORITY), anyString(), isNull());
    }

    @Test
    void initialize_secondTime_failsAlreadyInitialized() {
        when(configRepository.existsById(KEY)).thenReturn(true);

        assertRejected(() -> service.initialize(BOB), ErrorCode.ALREADY_INITIALIZED);
        verify(configRepository, never()).saveAndFlush(any());
        verifyNoInteractions(history);
    }

    @Test
    void initialize_lostCreationRace_failsAlreadyInitialized() {
        when(configRepository.existsById(KEY)).thenReturn(false);
        when(configRepository.saveAndFlush(any()))
                .thenThrow(new DataIntegrityViolationException("duplicate key",
                        new SQLException("duplicate key value violates unique constraint", "23505")));

        assertRejected(() -> service.initialize(AUTHORITY), ErrorCode.ALREADY_INITIALIZED);
        verifyNoInteractions(history);
    }

    @Test
    void initialize_otherIntegrityViolation_propagates() {
        when(configRepository.existsById(KEY)).thenReturn(false);
        when(configRepository.saveAndFlush(any()))
                .thenThrow(new DataIntegrityViolationException("value too long",
                        new SQLException("value too long for type character varying(64)", "22001")));

        assertThatThrownBy(() -> service.initialize(AUTHORITY))
                .isInstanceOf(DataIntegrityViolationException.class);
        verifyNoInteractions(history);
    }

    @Test
    void initialize_zeroCaller_isRejected() {
        assertRejected(() -> service.initialize(Address.ZERO), ErrorCode.UNAUTHORIZED_ADMIN);
        verifyNoInteractions(configRepository);
    }

    // ── addAdmin ──────────────────────────────────────────────────────────────

    @Test
    void addAdmin_byAuthority_appendsAndCounts() {
        AdminConfig config = stored(registry(AUTHORITY));

        AdminRegistryResponse result = service.addAdmin(AUTHORITY, BOB);

        assertThat(config.getAdmins()).containsExactly(AUTHORITY, BOB);
        assertThat(config.getAdminCount()).isEqualTo(2);
        assertThat(result.getAdmins()).containsExactly(AUTHORITY.toHex(), BOB.toHex());
        verify(history).record(any(), eq(LedgerAction.ADMIN_ADDED), eq(AUTHORITY), eq(BOB.toHex()), anyString());
    }

    @Test
    void addAdmin_byNonAuthority_failsAndLeavesStateUnchanged() {
        AdminConfig config = stored(registry(AUTHORITY, BOB));

        assertRejected(() -> service.addAdmin(BOB, CAROL), ErrorCode.UNAUTHORIZED_ADMIN);

        assertThat(config.getAdmins()).containsExactly(AUTHORITY, BOB);
        assertThat(config.getAdminCount()).isEqualTo(2);
        verifyNoInteractions(history);
    }

    @Test
    void addAdmin_duplicate_failsAdminAlreadyExists() {
        stored(registry(AUTHORITY, BOB));

        assertRejected(() -> service.addAdmin(AUTHORITY, BOB), ErrorCode.ADMIN_ALREADY_EXISTS);
    }

    @Test
    void addAdmin_atCapacity_failsMaxAdminsReached() {
        Address[] nine = new Address[9];
        for (int i = 0; i < 9; i++) {
            nine[i] = addr(10 + i);
        }
        AdminConfig config = stored(registry(AUTHORITY, nine));

        assertRejected(() -> service.addAdmin(AUTHORITY, CAROL), ErrorCode.MAX_ADMINS_REACHED);
        assertThat(config.getAdminCount()).isEqualTo(10);
    }

    @Test
    void addAdmin_capacityIsCheckedBeforeDuplicates() {
        Address[] nine = new Address[9];
        for (int i = 0; i < 9; i++) {
            nine[i] = addr(10 + i);
        }
        stored(registry(AUTHORITY, nine));

        assertRejected(() -> service.addAdmin(AUTHORITY, nine[0]), ErrorCode.MAX_ADMINS_REACHED);
    }

    @Test
    void addAdmin_uninitialized_failsNotInitialized() {
        when(configRepository.findByIdForUpdate(KEY)).thenReturn(Optional.empty());

        assertRejected(() -> service.addAdmin(AUTHORITY, BOB), ErrorCode.NOT_INITIALIZED);
    }

    // ── removeAdmin ───────────────────────────────────────────────────────────

    @Test
    void removeAdmin_movesLastAdminIntoVacatedSlot() {
        AdminConfig config = stored(registry(AUTHORITY, BOB, CAROL));

        service.removeAdmin(AUTHORITY, BOB);

        assertThat(config.getAdmins()).containsExactly(AUTHORITY, CAROL);
        assertThat(config.getAdminCount()).isEqualTo(2);
        verify(history).record(any(), eq(LedgerAction.ADMIN_REMOVED), eq(AUTHORITY), eq(BOB.toHex()), anyString());
    }

    @Test
    void removeAdmin_authorityMayRemoveItselfAndStillManageTheSet() {
        AdminConfig config = stored(registry(AUTHORITY, BOB));

        service.removeAdmin(AUTHORITY, AUTHORITY);
        assertThat(config.getAdmins()).containsExactly(BOB);
        assertThat(config.getAuthority()).isEqualTo(AUTHORITY);

        service.addAdmin(AUTHORITY, CAROL);
        assertThat(config.getAdmins()).containsExactly(BOB, CAROL);
    }

    @Test
    void removeAdmin_lastAdmin_alwaysFailsRegardlessOfTarget() {
        AdminConfig config = stored(registry(AUTHORITY));

        assertRejected(() -> service.removeAdmin(AUTHORITY, AUTHORITY), ErrorCode.CANNOT_REMOVE_LAST_ADMIN);
        assertRejected(() -> service.removeAdmin(AUTHORITY, BOB), ErrorCode.CANNOT_REMOVE_LAST_ADMIN);
        assertThat(config.getAdmins()).containsExactly(AUTHORITY);
    }

    @Test
    void removeAdmin_unknownTarget_failsAdminNotFound() {
        stored(registry(AUTHORITY, BOB));

        assertRejected(() -> service.removeAdmin(AUTHORITY, CAROL), ErrorCode.ADMIN_NOT_FOUND);
    }

    @Test
    void removeAdmin_byNonAuthority_failsAndLeavesStateUnchanged() {
        AdminConfig config = stored(registry(AUTHORITY, BOB));

        assertRejected(() -> service.removeAdmin(BOB, AUTHORITY), ErrorCode.UNAUTHORIZED_ADMIN);
        assertThat(config.getAdmins()).containsExactly(AUTHORITY, BOB);
        verifyNoInteractions(history);
    }

    // ── reads ─────────────────────────────────────────────────────────────────

    @Test
    void isAdmin_reflectsMembership() {
        when(configRepository.findById(KEY)).thenReturn(Optional.of(registry(AUTHORITY, BOB)));

        assertThat(service.isAdmin(BOB)).isTrue();
        assertThat(service.isAdmin(CAROL)).isFalse();
    }

    @Test
    void isAdmin_uninitializedRegistry_isFalse() {
        when(configRepository.findById(KEY)).thenReturn(Optional.empty());

        assertThat(service.isAdmin(AUTHORITY)).isFalse();
    }

    @Test
    void requireAdmin_nonMember_failsUnauthorized() {
        when(configRepository.findByIdForShare(KEY)).thenReturn(Optional.of(registry(AUTHORITY)));

        assertRejected(() -> service.requireAdmin(BOB), ErrorCode.UNAUTHORIZED_ADMIN);
    }

    @Test
    void getRegistry_uninitialized_failsNotInitialized() {
        when(configRepository.findById(KEY)).thenReturn(Optional.empty());

        assertRejected(() -> service.getRegistry(), ErrorCode.NOT_INITIALIZED);
    }

    // ── invariants ────────────────────────────────────────────────────────────

    @Test
    void randomMembershipChanges_keepCountInBoundsAndAdminsUnique() {
        AdminConfig config = stored(registry(AUTHORITY));
        List<Address> pool = new ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            pool.add(addr(i));
        }
        Random random = new Random(20240611L);

        for (int step = 0; step < 500; step++) {
            Address target = pool.get(random.nextInt(pool.size()));
            try {
                if (random.nextBoolean()) {
                    service.addAdmin(AUTHORITY, target);
                } else {
                    service.removeAdmin(AUTHORITY, target);
                }
            } catch (FormLedgerException expected) {
                assertThat(expected.getCode()).isIn(
                        ErrorCode.MAX_ADMINS_REACHED, ErrorCode.ADMIN_ALREADY_EXISTS,
                        ErrorCode.ADMIN_NOT_FOUND, ErrorCode.CANNOT_REMOVE_LAST_ADMIN);
            }

            assertThat(config.getAdminCount()).isBetween(1, AdminConfig.MAX_ADMINS);
            assertThat(config.getAdminCount()).isEqualTo(config.getAdmins().size());
            assertThat(new HashSet<>(config.getAdmins())).hasSize(config.getAdmins().size());
        }
    }
}
