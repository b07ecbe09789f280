package com.smallbiz.agent.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_business_status", columnList = "business_id, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public enum Status {
        SCHEDULED, CONFIRMED, COMPLETED, CANCELLED;

        /** Statuses that occupy the calendar and therefore take part in conflict checks. */
        public static final Set<Status> ACTIVE = EnumSet.of(SCHEDULED, CONFIRMED);

        public boolean isActive() {
            return ACTIVE.contains(this);
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "staff_id")
    private Long staffId;

    @Column(name = "service_id")
    private Long serviceId;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.SCHEDULED;

    @Column(columnDefinition = "text")
    private String notes;

    @Column(name = "google_event_id")
    private String googleEventId;

    @Column(name = "microsoft_event_id")
    private String microsoftEventId;

    @Column(name = "apple_event_id")
    private String appleEventId;

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Half-open interval test: appointments that only touch at a boundary do not overlap.
     */
    public boolean overlaps(LocalDateTime start, LocalDateTime end) {
        return start.isBefore(endTime) && end.isAfter(startTime);
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
