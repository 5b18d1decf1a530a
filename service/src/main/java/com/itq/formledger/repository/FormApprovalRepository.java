package com.itq.formledger.repository;

import com.itq.formledger.entity.FormApproval;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.Optional;

public interface FormApprovalRepository extends JpaRepository<FormApproval, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM FormApproval f WHERE f.address = :address")
    Optional<FormApproval> findByIdForUpdate(@Param("address") String address);
}
