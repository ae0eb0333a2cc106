package com.example.presence.repository;

import com.example.presence.entities.TimeWindow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TimeWindowRepository extends JpaRepository<TimeWindow, Long> {

    List<TimeWindow> findByActiveTrueOrderByStartTimeAscIdAsc();

    List<TimeWindow> findAllByOrderByStartTimeAscIdAsc();
}
