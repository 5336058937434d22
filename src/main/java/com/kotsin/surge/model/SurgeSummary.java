package com.kotsin.surge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * SurgeSummary - Aggregate view over all surges of one analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SurgeSummary {

    private int totalSurgesDetected;
    private int activeSurges;
    private int criticalSurges;
    private double averageSurgeDuration;    // hours
    private SurgeType mostCommonSurgeType;

    @Builder.Default
    private List<IntentType> topAffectedIntents = new ArrayList<>();

    @Builder.Default
    private List<String> topRelatedCompetitors = new ArrayList<>();

    /**
     * Summary for an analysis without surges. mostCommonSurgeType stays
     * SUDDEN_SPIKE so consumers never see a null type.
     */
    public static SurgeSummary empty() {
        return SurgeSummary.builder()
                .mostCommonSurgeType(SurgeType.SUDDEN_SPIKE)
                .build();
    }
}
