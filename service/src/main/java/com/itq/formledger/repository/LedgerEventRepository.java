package com.itq.formledger.repository;

import com.itq.formledger.domain.Address;
import com.itq.formledger.entity.LedgerEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LedgerEventRepository extends JpaRepository<LedgerEvent, Long> {

    List<LedgerEvent> findAllByAccountAddressOrderByIdAsc(Address accountAddress);
}
