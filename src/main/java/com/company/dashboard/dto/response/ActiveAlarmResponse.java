package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveAlarmResponse {
    private long alarmId;
    private String tag;
    private String message;
    private LocalDateTime startTime;
    private String priority;
    private int priorityLevel;
    private String section;
}
