package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * SignalDataPoint - One bucket of signal activity produced by the upstream collector.
 *
 * Consumed read-only by the detector. source, intent and competitor are
 * optional tags and feed the affected-source/intent/competitor sets of a surge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignalDataPoint {

    private Instant timestamp;
    private double count;

    // Optional tags
    private String source;
    private IntentType intent;
    private String competitor;
    private Map<String, Object> metadata;
}
