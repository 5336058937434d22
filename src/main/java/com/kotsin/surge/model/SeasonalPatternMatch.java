package com.kotsin.surge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * SeasonalPatternMatch - A named seasonal pattern the series matches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonalPatternMatch {

    private String pattern;
    private double confidence;          // 0-1
    private LocalDate nextOccurrence;   // first day of the next pattern month
}
