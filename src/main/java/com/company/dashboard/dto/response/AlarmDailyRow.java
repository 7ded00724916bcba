package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlarmDailyRow {
    private LocalDate day;
    private long alarms;
    private long criticalAlarms;
}
