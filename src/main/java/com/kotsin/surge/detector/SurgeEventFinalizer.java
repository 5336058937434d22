package com.kotsin.surge.detector;

import com.kotsin.surge.analyzer.RecommendationGenerator;
import com.kotsin.surge.calculator.ConfidenceScorer;
import com.kotsin.surge.config.SurgeDetectorConfig;
import com.kotsin.surge.model.BaselineStats;
import com.kotsin.surge.model.SurgeContext;
import com.kotsin.surge.model.SurgeDuration;
import com.kotsin.surge.model.SurgeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;

/**
 * SurgeEventFinalizer - Completes a closed surge candidate.
 *
 * Steps, in order:
 * 1. Duration (to endTime, or to now when ongoing)
 * 2. Potential causes
 * 3. Type
 * 4. Severity
 * 5. Confidence
 * 6. Recommendation
 */
@Slf4j
@Component
public class SurgeEventFinalizer {

    private final SurgeClassifier classifier;
    private final CauseAttributor causeAttributor;
    private final ConfidenceScorer confidenceScorer;
    private final RecommendationGenerator recommendationGenerator;
    private final Clock clock;

    public SurgeEventFinalizer(SurgeClassifier classifier,
                               CauseAttributor causeAttributor,
                               ConfidenceScorer confidenceScorer,
                               RecommendationGenerator recommendationGenerator,
                               Clock clock) {
        this.classifier = classifier;
        this.causeAttributor = causeAttributor;
        this.confidenceScorer = confidenceScorer;
        this.recommendationGenerator = recommendationGenerator;
        this.clock = clock;
    }

    public SurgeEvent finalizeSurge(SurgeEvent surge, BaselineStats baseline,
                                    SurgeContext context, SurgeDetectorConfig config) {
        Instant end = surge.getEndTime() != null ? surge.getEndTime() : clock.instant();
        surge.setDuration(SurgeDuration.of(Duration.between(surge.getStartTime(), end)));

        CauseAttribution attribution = causeAttributor.attribute(surge, context);
        surge.setPotentialCauses(new ArrayList<>(attribution.causes()));

        surge.setType(classifier.determineType(surge, attribution));
        surge.setSeverity(classifier.determineSeverity(surge.getStandardDeviationsAbove(),
                config.getSeverityThresholds()));
        surge.setConfidence(confidenceScorer.score(surge, baseline));
        surge.setRecommendation(recommendationGenerator.generate(surge));

        log.debug("SURGE FINALIZED | id={} | type={} | severity={} | stdDevs={} | hours={} | ongoing={} | causes={}",
                surge.getId(), surge.getType(), surge.getSeverity(),
                String.format("%.2f", surge.getStandardDeviationsAbove()),
                String.format("%.1f", surge.getDuration().getHours()),
                surge.isOngoing(), surge.getPotentialCauses().size());
        return surge;
    }
}
