package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * SurgeEvent - A contiguous run of data points above the surge threshold.
 *
 * Lifecycle:
 * - Opened by the scanner on the first surging point
 * - Peak and affected sets updated while the run continues
 * - Finalized exactly once (duration, type, severity, causes, confidence,
 *   recommendation) when the run ends or the data ends mid-run
 *
 * endTime is null while the surge is ongoing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SurgeEvent {

    private String id;
    private SurgeType type;
    private SurgeSeverity severity;

    // ==================== TIMING ====================
    private Instant startTime;
    private Instant endTime;
    private Instant peakTime;
    private SurgeDuration duration;

    @JsonProperty("isOngoing")
    private boolean ongoing;

    // ==================== MAGNITUDE ====================
    private double peakValue;
    private double baselineValue;
    private double percentageIncrease;
    private double standardDeviationsAbove;

    // ==================== ATTRIBUTION ====================
    @Builder.Default
    private List<String> affectedSources = new ArrayList<>();

    @Builder.Default
    private List<IntentType> affectedIntents = new ArrayList<>();

    @Builder.Default
    private List<String> relatedCompetitors = new ArrayList<>();

    @Builder.Default
    private List<String> potentialCauses = new ArrayList<>();

    // ==================== ASSESSMENT ====================
    private double confidence;      // 0-1
    private String recommendation;
}
