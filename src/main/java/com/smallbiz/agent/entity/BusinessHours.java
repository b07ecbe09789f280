package com.smallbiz.agent.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalTime;

@Entity
@Table(name = "business_hours", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"business_id", "day_of_week"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BusinessHours {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    /**
     * Day of week: 1 = Monday, 7 = Sunday (java.time.DayOfWeek)
     */
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "open_time")
    private LocalTime openTime;

    @Column(name = "close_time")
    private LocalTime closeTime;

    @Column(nullable = false)
    private boolean closed;

    /** True when the row describes a day the business actually opens. */
    public boolean isOpenDay() {
        return !closed && openTime != null && closeTime != null && openTime.isBefore(closeTime);
    }
}
