package com.example.presence.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyStatsResponse {
    private LocalDate date;
    private long totalEvents;
    private long presentCount;
    private long lateCount;
    private long absentCount;
    private long outsideCount;
    private long manualCount;
    private long autoCount;
}
