package com.kotsin.surge.model;

import java.util.Arrays;
import java.util.List;

/**
 * SeasonalPattern - Named calendar-month sets with recurring activity.
 *
 * Months are 1-12 and listed in ascending order.
 */
public enum SeasonalPattern {

    Q4_BUDGET("q4-budget", 10, 11, 12),         // Q4 budget spending
    Q1_PLANNING("q1-planning", 1, 2),           // New year planning
    TAX_SEASON("tax-season", 2, 3, 4),          // Tax/accounting season
    BACK_TO_SCHOOL("back-to-school", 8, 9),     // Educational buying
    BLACK_FRIDAY("black-friday", 11),           // Retail/commerce surge
    YEAR_END("year-end", 12),                   // Year-end deals
    SUMMER_SLOWDOWN("summer-slowdown", 7, 8);   // Typical B2B slowdown

    private final String patternName;
    private final List<Integer> months;

    SeasonalPattern(String patternName, Integer... months) {
        this.patternName = patternName;
        this.months = List.copyOf(Arrays.asList(months));
    }

    public String getPatternName() {
        return patternName;
    }

    public List<Integer> getMonths() {
        return months;
    }

    public boolean contains(int month) {
        return months.contains(month);
    }

    /**
     * Check if any pattern covers the month.
     */
    public static boolean anyContains(int month) {
        for (SeasonalPattern pattern : values()) {
            if (pattern.contains(month)) {
                return true;
            }
        }
        return false;
    }
}
