package com.kotsin.surge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * CurrentActivity - Assessment of the most recent data point.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentActivity {

    private ActivityLevel level;
    private double value;
    private double percentileRank;  // 0-100, share of values strictly below

    public static CurrentActivity empty() {
        return new CurrentActivity(ActivityLevel.NORMAL, 0, 50);
    }
}
