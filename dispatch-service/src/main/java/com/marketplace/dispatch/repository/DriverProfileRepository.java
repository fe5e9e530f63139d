package com.marketplace.dispatch.repository;

import com.marketplace.dispatch.entity.DriverProfile;
import com.marketplace.dispatch.model.AvailableDriver;
import com.marketplace.shared.enums.DriverApprovalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DriverProfileRepository extends JpaRepository<DriverProfile, String> {

    /**
     * Candidate pool: approved, online drivers whose last location report is
     * not older than {@code freshSince}, excluding the customer themself.
     */
    @Query("SELECT new com.marketplace.dispatch.model.AvailableDriver(p, l) " +
           "FROM DriverProfile p JOIN DriverLocation l ON l.driverId = p.driverId " +
           "WHERE p.approvalStatus = :approval " +
           "AND p.online = true " +
           "AND l.updatedAt >= :freshSince " +
           "AND p.driverId <> :customerId")
    List<AvailableDriver> findAvailableDrivers(@Param("approval") DriverApprovalStatus approval,
                                               @Param("freshSince") Instant freshSince,
                                               @Param("customerId") String customerId);
}
