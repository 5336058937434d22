package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * SurgeAnalysisResult - Output of one full analysis run.
 *
 * surges are sorted by standardDeviationsAbove descending, predictions by
 * probability descending.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SurgeAnalysisResult {

    @Builder.Default
    private List<SurgeEvent> surges = new ArrayList<>();

    private BaselineStats baseline;
    private CurrentActivity currentActivity;

    @Builder.Default
    private List<SurgePrediction> predictions = new ArrayList<>();

    private SurgeSummary summary;
}
