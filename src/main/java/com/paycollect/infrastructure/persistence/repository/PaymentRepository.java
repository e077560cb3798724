package com.paycollect.infrastructure.persistence.repository;

import com.paycollect.domain.model.PaymentHistoryItem;
import com.paycollect.domain.model.PaymentListItem;
import com.paycollect.infrastructure.persistence.entity.PaymentEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, Integer> {

    @Query("SELECT new com.paycollect.domain.model.PaymentListItem("
            + "p.id, p.paymentDate, p.paymentAmount, p.status, p.accountNumber, c.customerName) "
            + "FROM PaymentEntity p JOIN p.customer c "
            + "ORDER BY p.paymentDate DESC, p.id DESC")
    List<PaymentListItem> findPageWithCustomerName(Pageable pageable);

    @Query("SELECT new com.paycollect.domain.model.PaymentHistoryItem("
            + "p.id, p.paymentDate, p.paymentAmount, p.status, c.customerName) "
            + "FROM PaymentEntity p JOIN p.customer c "
            + "WHERE p.accountNumber = :accountNumber "
            + "ORDER BY p.paymentDate DESC, p.id DESC")
    List<PaymentHistoryItem> findHistoryByAccountNumber(@Param("accountNumber") String accountNumber);
}
