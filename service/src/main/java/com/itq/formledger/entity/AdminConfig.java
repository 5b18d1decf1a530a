package com.itq.formledger.entity;

import com.itq.formledger.domain.Address;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.util.ArrayList;
import java.util.List;

/**
 * Singleton admin registry, stored at the address derived from {@code "admin_config"}.
 * {@code adminCount} always equals {@code admins.size()}.
 */
@Entity
@Table(name = "admin_config")
@Getter
@Setter
public class AdminConfig implements Persistable<String> {

    public static final int MAX_ADMINS = 10;

    /** Hex form of the derived storage address. */
    @Id
    @Column(nullable = false, length = 64)
    private String address;

    @Convert(converter = AddressConverter.class)
    @Column(nullable = false, updatable = false, length = 64)
    private Address authority;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "admin_config_members", joinColumns = @JoinColumn(name = "config_address"))
    @OrderColumn(name = "slot")
    @Convert(converter = AddressConverter.class)
    @Column(name = "admin_address", nullable = false, length = 64)
    private List<Address> admins = new ArrayList<>();

    @Column(name = "admin_count", nullable = false)
    private int adminCount;

    @Column(nullable = false, updatable = false)
    private int bump;

    @Transient
    private boolean fresh = true;

    public boolean isAdmin(Address candidate) {
        return admins.contains(candidate);
    }

    public boolean isFull() {
        return adminCount >= MAX_ADMINS;
    }

    public void appendAdmin(Address admin) {
        admins.add(admin);
        adminCount = admins.size();
    }

    /** Keeps slots dense: the last admin moves into the vacated slot. */
    public void removeAdmin(Address admin) {
        int index = admins.indexOf(admin);
        int last = admins.size() - 1;
        if (index < last) {
            admins.set(index, admins.get(last));
        }
        admins.remove(last);
        adminCount = admins.size();
    }

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
