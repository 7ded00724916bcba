package com.company.dashboard.domain;

import com.company.dashboard.domain.enums.AlarmPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveAlarm {
    private long alarmId;
    private String tag;
    private String message;
    private LocalDateTime startTime;
    private AlarmPriority priority;
    private String section;
}
