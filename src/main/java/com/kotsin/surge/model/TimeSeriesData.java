package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * TimeSeriesData - Ordered signal data points plus granularity and bounds.
 *
 * Points are expected in ascending timestamp order. The service checks the
 * order at its boundary and sorts a copy when callers did not presort.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimeSeriesData {

    @Builder.Default
    private List<SignalDataPoint> dataPoints = new ArrayList<>();

    private TimeGranularity granularity;
    private Instant startDate;
    private Instant endDate;

    public int size() {
        return dataPoints == null ? 0 : dataPoints.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return size() == 0;
    }
}
