package com.paycollect.infrastructure.persistence.repository;

import com.paycollect.infrastructure.persistence.entity.CustomerEntity;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerRepository extends JpaRepository<CustomerEntity, Integer> {

    Optional<CustomerEntity> findByAccountNumber(String accountNumber);

    @Query("SELECT c FROM CustomerEntity c")
    List<CustomerEntity> findPage(Pageable pageable);

    /**
     * Find customer with pessimistic write lock ({@code SELECT ... FOR UPDATE}).
     *
     * Concurrent payments on the same account queue on the row lock, so the
     * read of {@code emi_due} and its update cannot interleave.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT c FROM CustomerEntity c WHERE c.accountNumber = :accountNumber")
    Optional<CustomerEntity> findByAccountNumberForUpdate(@Param("accountNumber") String accountNumber);
}
