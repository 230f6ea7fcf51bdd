package com.billreminder.repository;

import com.billreminder.domain.model.ReminderDispatchLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ReminderDispatchLogRepository extends JpaRepository<ReminderDispatchLog, Long> {
    boolean existsByReminderIdAndOccurrenceKey(Long reminderId, String occurrenceKey);

    List<ReminderDispatchLog> findByReminderIdOrderBySentAtDesc(Long reminderId);

    @Query("select l.occurrenceKey from ReminderDispatchLog l where l.reminderId = :reminderId")
    List<String> findOccurrenceKeysByReminderId(@Param("reminderId") Long reminderId);
}
