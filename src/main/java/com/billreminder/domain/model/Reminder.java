package com.billreminder.domain.model;

import com.billreminder.domain.enums.Frequency;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "reminders", indexes = {
        @Index(name = "idx_reminders_active", columnList = "active"),
        @Index(name = "idx_reminders_user", columnList = "user_id")
})
public class Reminder extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(nullable = false, length = 2000)
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Frequency frequency;

    @Column(name = "remind_at", nullable = false)
    private LocalTime remindAt;

    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", length = 16)
    private DayOfWeek dayOfWeek;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(length = 64)
    private String timezone;

    @Column(name = "advance_notice_days", nullable = false)
    private int advanceNoticeDays = 0;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "last_sent_at")
    private OffsetDateTime lastSentAt;

    /**
     * Moves {@code lastSentAt} forward to {@code sentAt}; an older timestamp is ignored.
     */
    public void recordSent(OffsetDateTime sentAt) {
        if (sentAt == null) {
            return;
        }
        if (lastSentAt == null || sentAt.isAfter(lastSentAt)) {
            lastSentAt = sentAt;
        }
    }
}
