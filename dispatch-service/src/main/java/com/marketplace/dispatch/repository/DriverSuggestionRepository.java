package com.marketplace.dispatch.repository;

import com.marketplace.dispatch.entity.DriverSuggestion;
import com.marketplace.dispatch.model.OfferCycleKey;
import com.marketplace.shared.enums.OrderStatus;
import com.marketplace.shared.enums.ServiceType;
import com.marketplace.shared.enums.SuggestionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
public interface DriverSuggestionRepository extends JpaRepository<DriverSuggestion, UUID> {

    boolean existsByCustomerOrderIdAndStatusAndExpiresAtAfter(
            UUID orderId, SuggestionStatus status, Instant now);

    List<DriverSuggestion> findByCustomerOrderIdAndStatus(UUID orderId, SuggestionStatus status);

    List<DriverSuggestion> findByCustomerOrderIdAndCycleAndStatus(
            UUID orderId, int cycle, SuggestionStatus status);

    List<DriverSuggestion> findByCustomerOrderIdOrderByCycleAscDriverIdAsc(UUID orderId);

    Optional<DriverSuggestion> findFirstByCustomerOrderIdAndDriverIdAndStatus(
            UUID orderId, String driverId, SuggestionStatus status);

    /** Every driver the order was ever offered to, whatever the outcome. */
    @Query("SELECT DISTINCT s.driverId FROM DriverSuggestion s WHERE s.customerOrder.id = :orderId")
    Set<String> findOfferedDriverIds(@Param("orderId") UUID orderId);

    @Query("SELECT s FROM DriverSuggestion s JOIN FETCH s.customerOrder o " +
           "WHERE s.driverId = :driverId " +
           "AND s.status = com.marketplace.shared.enums.SuggestionStatus.SENT " +
           "AND s.expiresAt > :now " +
           "AND o.assignedDriverId IS NULL " +
           "AND o.status IN :statuses " +
           "AND o.serviceType IN :serviceTypes " +
           "ORDER BY o.createdAt DESC")
    List<DriverSuggestion> findLiveOffersForDriver(@Param("driverId") String driverId,
                                                   @Param("now") Instant now,
                                                   @Param("statuses") Collection<OrderStatus> statuses,
                                                   @Param("serviceTypes") Collection<ServiceType> serviceTypes);

    /**
     * Cycles whose offers are still SENT well past their deadline, i.e. whose
     * expiry timer never fired. Only the current cycle of each order qualifies.
     */
    @Query("SELECT DISTINCT new com.marketplace.dispatch.model.OfferCycleKey(s.customerOrder.id, s.cycle) " +
           "FROM DriverSuggestion s, DispatchState d " +
           "WHERE d.orderId = s.customerOrder.id " +
           "AND s.cycle = d.cycle " +
           "AND s.status = com.marketplace.shared.enums.SuggestionStatus.SENT " +
           "AND s.expiresAt < :cutoff")
    List<OfferCycleKey> findOverdueCycles(@Param("cutoff") Instant cutoff);
}
