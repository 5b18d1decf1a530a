package com.itq.formledger.repository;

import com.itq.formledger.entity.CallerNonce;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.Optional;

public interface CallerNonceRepository extends JpaRepository<CallerNonce, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT n FROM CallerNonce n WHERE n.caller = :caller")
    Optional<CallerNonce> findByIdForUpdate(@Param("caller") String caller);
}
