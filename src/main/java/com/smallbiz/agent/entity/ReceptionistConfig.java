package com.smallbiz.agent.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "receptionist_config")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReceptionistConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false, unique = true)
    private Long businessId;

    @Column(columnDefinition = "text")
    private String greeting;

    @Column(name = "after_hours_message", columnDefinition = "text")
    private String afterHoursMessage;

    @Convert(converter = StringListConverter.class)
    @Column(name = "emergency_keywords", columnDefinition = "text")
    @Builder.Default
    private List<String> emergencyKeywords = new ArrayList<>();

    @Column(name = "voicemail_enabled", nullable = false)
    @Builder.Default
    private boolean voicemailEnabled = true;

    @Column(name = "emergency_transfer_number", length = 32)
    private String emergencyTransferNumber;

    @Column(name = "manager_transfer_number", length = 32)
    private String managerTransferNumber;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
