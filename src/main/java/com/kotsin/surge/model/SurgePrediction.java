package com.kotsin.surge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SurgePrediction {

    private PredictionType type;
    private double probability;
    private String expectedTimeframe;
    private String basedOn;
    private double confidence;
}
