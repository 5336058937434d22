package com.kotsin.surge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SurgeDuration {

    private double hours;
    private double days;

    public static SurgeDuration of(Duration duration) {
        double hours = duration.toMillis() / (1000.0 * 60 * 60);
        return new SurgeDuration(hours, hours / 24);
    }
}
