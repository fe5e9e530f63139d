package com.marketplace.dispatch.repository;

import com.marketplace.dispatch.entity.DispatchState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Always taken after the owning order row is locked.
 */
@Repository
public interface DispatchStateRepository extends JpaRepository<DispatchState, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DispatchState s WHERE s.orderId = :orderId")
    Optional<DispatchState> lockByOrderId(@Param("orderId") UUID orderId);
}
