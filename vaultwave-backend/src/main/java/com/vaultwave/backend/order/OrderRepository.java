package com.vaultwave.backend.order;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    Optional<Order> findByIdAndBuyerId(Long id, Long buyerId);

    List<Order> findAllByBuyerIdOrderByCreatedAtDesc(Long buyerId);

    Optional<Order> findByPaymentReference(String paymentReference);

    // Every mutation of an order goes through this row lock
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id")
    Optional<Order> findByIdForUpdate(@Param("id") Long id);
}
