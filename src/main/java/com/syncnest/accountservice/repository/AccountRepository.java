package com.syncnest.accountservice.repository;

import com.syncnest.accountservice.entity.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByEmail(String email);

    Optional<Account> findByEmailAndActiveTrueAndVerifiedTrue(String email);

    /**
     * Flips {@code verified} for a still-unverified account.
     *
     * @return 1 when this call performed the transition, 0 when it was already verified or absent
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Account a set a.verified = true where a.email = :email and a.verified = false")
    int markVerified(@Param("email") String email);
}
