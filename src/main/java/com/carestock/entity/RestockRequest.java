package com.carestock.entity;

import com.carestock.dto.RequestOrigin;
import com.carestock.dto.RestockPriority;
import com.carestock.dto.RestockStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
    name = "restock_requests",
    indexes = {
        @Index(name = "idx_restock_item_status", columnList = "item_id, status"),
        @Index(name = "idx_restock_facility",    columnList = "facility_id"),
        @Index(name = "idx_restock_requested",   columnList = "requested_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RestockRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    // Lookup reference only; the catalog owns the item.
    @Column(name = "item_id", nullable = false, updatable = false)
    private Long itemId;

    @Column(name = "facility_id", updatable = false)
    private Long facilityId;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private RestockPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RestockStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private RequestOrigin origin;

    @Column(name = "days_remaining", updatable = false)
    private Long daysRemaining;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private Instant requestedAt;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "fulfilled_at")
    private Instant fulfilledAt;

    @Column(length = 1000)
    private String comments;
}
