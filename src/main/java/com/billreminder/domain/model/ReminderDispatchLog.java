package com.billreminder.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "reminder_dispatch_log",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_dispatch_log_occurrence", columnNames = {"reminder_id", "occurrence_key"})
        },
        indexes = {
                @Index(name = "idx_dispatch_log_reminder", columnList = "reminder_id,sent_at")
        })
public class ReminderDispatchLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reminder_id", nullable = false, updatable = false)
    private Long reminderId;

    @Column(name = "occurrence_key", nullable = false, updatable = false, length = 64)
    private String occurrenceKey;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "sent_at", nullable = false, updatable = false)
    private OffsetDateTime sentAt;

    public ReminderDispatchLog(Long reminderId, String occurrenceKey, Long userId, OffsetDateTime sentAt) {
        this.reminderId = reminderId;
        this.occurrenceKey = occurrenceKey;
        this.userId = userId;
        this.sentAt = sentAt;
    }
}
