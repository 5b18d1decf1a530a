package com.itq.formledger.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * Next sequence number a caller must sign into a request. Each accepted
 * signature consumes one value, so a captured request cannot be submitted twice.
 */
@Entity
@Table(name = "caller_nonce")
@Getter
@Setter
public class CallerNonce implements Persistable<String> {

    /** Hex form of the caller's address. */
    @Id
    @Column(nullable = false, length = 64)
    private String caller;

    @Column(name = "next_nonce", nullable = false)
    private long nextNonce;

    @Transient
    private boolean fresh = true;

    @Override
    public String getId() {
        return caller;
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
