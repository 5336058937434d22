package com.kotsin.surge.detector;

import com.kotsin.surge.config.SeverityThresholds;
import com.kotsin.surge.model.SeasonalPattern;
import com.kotsin.surge.model.SurgeEvent;
import com.kotsin.surge.model.SurgeSeverity;
import com.kotsin.surge.model.SurgeType;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;

/**
 * SurgeClassifier - Type and severity of a finalized surge.
 *
 * Type (first match wins):
 * 1. Related competitors present      -> COMPETITOR_RELATED
 * 2. Externally driven causes found   -> EVENT_DRIVEN
 * 3. Duration <= 3 days               -> SUDDEN_SPIKE
 * 4. Duration >= 7 days, start month in a seasonal pattern -> RECURRING_PATTERN
 * 5. Duration >= 7 days               -> SUSTAINED_TREND
 * 6. Otherwise                        -> SUDDEN_SPIKE
 */
@Component
public class SurgeClassifier {

    private static final double SPIKE_MAX_DAYS = 3;
    private static final double TREND_MIN_DAYS = 7;

    public SurgeType determineType(SurgeEvent surge, CauseAttribution attribution) {
        if (!surge.getRelatedCompetitors().isEmpty()) {
            return SurgeType.COMPETITOR_RELATED;
        }
        if (attribution.externallyDriven()) {
            return SurgeType.EVENT_DRIVEN;
        }

        double days = surge.getDuration().getDays();
        if (days <= SPIKE_MAX_DAYS) {
            return SurgeType.SUDDEN_SPIKE;
        }
        if (days >= TREND_MIN_DAYS) {
            int month = surge.getStartTime().atZone(ZoneOffset.UTC).getMonthValue();
            return SeasonalPattern.anyContains(month) ? SurgeType.RECURRING_PATTERN : SurgeType.SUSTAINED_TREND;
        }
        return SurgeType.SUDDEN_SPIKE;
    }

    /**
     * Highest cut-point the value meets, checked from CRITICAL down.
     * Anything below MODERATE is MINOR.
     */
    public SurgeSeverity determineSeverity(double stdDevs, SeverityThresholds thresholds) {
        if (stdDevs >= thresholds.critical()) return SurgeSeverity.CRITICAL;
        if (stdDevs >= thresholds.significant()) return SurgeSeverity.SIGNIFICANT;
        if (stdDevs >= thresholds.moderate()) return SurgeSeverity.MODERATE;
        return SurgeSeverity.MINOR;
    }
}
