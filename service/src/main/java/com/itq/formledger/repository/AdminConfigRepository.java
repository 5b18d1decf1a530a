package com.itq.formledger.repository;

import com.itq.formledger.entity.AdminConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.Optional;

public interface AdminConfigRepository extends JpaRepository<AdminConfig, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM AdminConfig c WHERE c.address = :address")
    Optional<AdminConfig> findByIdForUpdate(@Param("address") String address);

    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT c FROM AdminConfig c WHERE c.address = :address")
    Optional<AdminConfig> findByIdForShare(@Param("address") String address);
}
