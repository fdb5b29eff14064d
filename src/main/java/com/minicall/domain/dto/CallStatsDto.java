package com.minicall.domain.dto;

import lombok.Data;

@Data
public class CallStatsDto {
    private long totalCalls;
    private long totalDurationSeconds;
    private long videoCalls;
    private long voiceCalls;
    private long missedCalls;
    private long completedCalls;
    /** 按 completedCalls 平均，向下取整 */
    private long averageDurationSeconds;
}
