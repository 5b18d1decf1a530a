package com.itq.formledger.entity;

import com.itq.formledger.domain.Address;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Append-only history row written in the same transaction as the state change it describes.
 */
@Entity
@Table(name = "ledger_event")
@Getter
@Setter
public class LedgerEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = AddressConverter.class)
    @Column(name = "account_address", nullable = false, updatable = false, length = 64)
    private Address accountAddress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private LedgerAction action;

    @Convert(converter = AddressConverter.class)
    @Column(nullable = false, updatable = false, length = 64)
    private Address actor;

    @Column(updatable = false, length = 64)
    private String subject;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private long recordedAt;

    @Column(updatable = false, length = 1000)
    private String detail;
}
