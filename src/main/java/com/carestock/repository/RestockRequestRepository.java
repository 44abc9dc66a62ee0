package com.carestock.repository;

import com.carestock.dto.RestockStatus;
import com.carestock.entity.RestockRequest;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RestockRequestRepository extends JpaRepository<RestockRequest, Long> {

    Optional<RestockRequest> findFirstByItemIdAndStatusIn(Long itemId, Collection<RestockStatus> statuses);

    List<RestockRequest> findByStatusIn(Collection<RestockStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RestockRequest r WHERE r.id = :id")
    Optional<RestockRequest> findByIdForUpdate(@Param("id") Long id);

    @Query("""
        SELECT r FROM RestockRequest r
        WHERE (:status IS NULL OR r.status = :status)
          AND (:facilityId IS NULL OR r.facilityId = :facilityId)
        ORDER BY r.requestedAt ASC, r.id ASC
    """)
    List<RestockRequest> search(
        @Param("status")     RestockStatus status,
        @Param("facilityId") Long facilityId
    );
}
