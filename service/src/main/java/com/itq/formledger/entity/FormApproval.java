package com.itq.formledger.entity;

import com.itq.formledger.domain.Address;
import com.itq.formledger.domain.FormHash;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * Approval record for one document. Every column except {@code metadata} is
 * written once and never updated.
 */
@Entity
@Table(name = "form_approval")
@Getter
@Setter
public class FormApproval implements Persistable<String> {

    public static final int MAX_FORM_ID_LENGTH = 64;
    public static final int MAX_METADATA_LENGTH = 256;

    /** Hex form of the derived storage address. */
    @Id
    @Column(nullable = false, length = 64)
    private String address;

    @Column(name = "document_id", nullable = false, unique = true, updatable = false, length = 64)
    private String documentId;

    @Convert(converter = FormHashConverter.class)
    @Column(name = "document_hash", nullable = false, updatable = false, length = 64)
    private FormHash documentHash;

    @Convert(converter = AddressConverter.class)
    @Column(nullable = false, updatable = false, length = 64)
    private Address signer;

    @Column(name = "approved_at", nullable = false, updatable = false)
    private long approvedAt;

    @Column(nullable = false, length = 256)
    private String metadata = "";

    @Column(nullable = false, updatable = false)
    private int bump;

    @Transient
    private boolean fresh = true;

    @Override
    public String getId() {
        return address;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        fresh = false;
    }
}
