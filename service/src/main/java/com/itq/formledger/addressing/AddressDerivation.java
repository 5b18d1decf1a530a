package com.itq.formledger.addressing;

import com.itq.formledger.domain.Address;
import com.itq.formledger.domain.Digests;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Maps seeds to storage addresses. The layout is
 * {@code SHA-256(seed_1 || ... || seed_n || bump || programId || "ProgramDerivedAddress")},
 * with the bump tried from 255 downward. Anyone holding the program id can
 * recompute a record's address from its document id alone.
 */
@Component
public class AddressDerivation {

    private static final byte[] ADMIN_CONFIG_SEED = "admin_config".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FORM_APPROVAL_SEED = "form_approval".getBytes(StandardCharsets.US_ASCII);

    private static final byte[] MARKER = "ProgramDerivedAddress".getBytes(StandardCharsets.US_ASCII);

    private final Address programId;

    @Autowired
    public AddressDerivation(@Value("${formledger.program-id}") String programIdHex) {
        this(Address.fromHex(programIdHex));
    }

    public AddressDerivation(Address programId) {
        if (programId.isZero()) {
            throw new IllegalArgumentException("Program id must not be the zero address");
        }
        this.programId = programId;
    }

    public Address getProgramId() {
        return programId;
    }

    public DerivedAddress adminConfigAddress() {
        return derive(ADMIN_CONFIG_SEED);
    }

    public DerivedAddress formApprovalAddress(String documentId) {
        return derive(FORM_APPROVAL_SEED, documentId.getBytes(StandardCharsets.UTF_8));
    }

    public DerivedAddress derive(byte[]... seeds) {
        byte[] programBytes = programId.toBytes();
        for (int bump = 255; bump >= 0; bump--) {
            byte[][] parts = Arrays.copyOf(seeds, seeds.length + 3);
            parts[seeds.length] = new byte[] {(byte) bump};
            parts[seeds.length + 1] = programBytes;
            parts[seeds.length + 2] = MARKER;
            Address candidate = Address.of(Digests.sha256(parts));
            if (!candidate.isZero()) {
                return new DerivedAddress(candidate, bump);
            }
        }
        throw new IllegalStateException("No usable bump for seeds");
    }
}
