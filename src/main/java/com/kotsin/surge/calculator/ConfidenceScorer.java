package com.kotsin.surge.calculator;

import com.kotsin.surge.model.BaselineStats;
import com.kotsin.surge.model.SurgeEvent;
import com.kotsin.surge.util.MathUtils;
import org.springframework.stereotype.Component;

/**
 * ConfidenceScorer - How much to trust a finalized surge (0-1).
 *
 * Starts at 0.5 and adds bonus tiers:
 * - Std dev magnitude: +0.25 at >=4, +0.15 at >=3, +0.10 at >=2.5
 * - Source diversity: +0.15 at >=3 sources, +0.10 at >=2
 * - Known cause: +0.10
 * - Duration >= 3 days: +0.10
 * - Baseline richness: +0.10 at >=30 points, +0.05 at >=14
 */
@Component
public class ConfidenceScorer {

    private static final double BASE_CONFIDENCE = 0.5;

    public double score(SurgeEvent surge, BaselineStats baseline) {
        double confidence = BASE_CONFIDENCE;

        double stdDevs = surge.getStandardDeviationsAbove();
        if (stdDevs >= 4) confidence += 0.25;
        else if (stdDevs >= 3) confidence += 0.15;
        else if (stdDevs >= 2.5) confidence += 0.1;

        int sources = surge.getAffectedSources().size();
        if (sources >= 3) confidence += 0.15;
        else if (sources >= 2) confidence += 0.1;

        if (!surge.getPotentialCauses().isEmpty()) confidence += 0.1;

        // Longer runs are less likely to be noise
        if (surge.getDuration() != null && surge.getDuration().getDays() >= 3) confidence += 0.1;

        int baselinePoints = baseline.getDataPointCount();
        if (baselinePoints >= 30) confidence += 0.1;
        else if (baselinePoints >= 14) confidence += 0.05;

        return MathUtils.clampConfidence(confidence);
    }
}
