package com.billreminder.repository;

import com.billreminder.domain.model.Reminder;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ReminderRepository extends JpaRepository<Reminder, Long> {
    List<Reminder> findByActiveTrueOrderByIdAsc();

    List<Reminder> findByUserIdOrderByIdAsc(Long userId);

    Optional<Reminder> findByIdAndUserId(Long id, Long userId);
}
