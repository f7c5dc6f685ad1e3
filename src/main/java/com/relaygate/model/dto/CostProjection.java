package com.relaygate.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Naive run-rate projection from recent spend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostProjection {
    private double nextHour;
    private double nextDay;
    private double nextWeek;
    private double nextMonth;
}
