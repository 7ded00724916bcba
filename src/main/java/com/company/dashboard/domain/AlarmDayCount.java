package com.company.dashboard.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlarmDayCount {
    private LocalDate day;
    private long alarms;
    private long criticalAlarms;
}
