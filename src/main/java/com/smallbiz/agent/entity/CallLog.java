package com.smallbiz.agent.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "call_log", indexes = {
    @Index(name = "idx_call_log_business", columnList = "business_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class CallLog {

    public enum Status { ANSWERED, MISSED, VOICEMAIL, TRANSFERRED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Column(name = "caller_id", length = 64)
    private String callerId;

    @Column(name = "caller_name", length = 200)
    private String callerName;

    @Column(columnDefinition = "text")
    private String transcript;

    @Column(name = "intent_detected", length = 40)
    private String intentDetected;

    @Column(nullable = false)
    private boolean emergency;

    @Column(name = "call_duration_seconds")
    private Integer callDurationSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.ANSWERED;

    @Column(name = "call_time", nullable = false)
    private Instant callTime;

    @PrePersist
    protected void onCreate() {
        if (callTime == null) callTime = Instant.now();
    }
}
