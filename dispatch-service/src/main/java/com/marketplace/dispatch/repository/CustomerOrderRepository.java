package com.marketplace.dispatch.repository;

import com.marketplace.dispatch.entity.CustomerOrder;
import com.marketplace.shared.enums.OrderStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerOrderRepository extends JpaRepository<CustomerOrder, UUID> {

    Optional<CustomerOrder> findByIdempotencyKey(String idempotencyKey);

    /**
     * SELECT ... FOR UPDATE on the order row. Used by driver and customer
     * actions, which wait for the lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM CustomerOrder o WHERE o.id = :id")
    Optional<CustomerOrder> lockById(@Param("id") UUID id);

    /**
     * Same row lock with a bounded wait, for background passes that can simply
     * retry on the next tick.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT o FROM CustomerOrder o WHERE o.id = :id")
    Optional<CustomerOrder> tryLockById(@Param("id") UUID id);

    @Query("SELECT o.id FROM CustomerOrder o " +
           "WHERE o.assignedDriverId IS NULL AND o.status IN :statuses " +
           "ORDER BY o.createdAt")
    List<UUID> findUnassignedIdsByStatusIn(@Param("statuses") Collection<OrderStatus> statuses);
}
