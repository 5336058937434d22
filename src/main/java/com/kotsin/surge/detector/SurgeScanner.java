package com.kotsin.surge.detector;

import com.kotsin.surge.config.SurgeDetectorConfig;
import com.kotsin.surge.model.BaselineStats;
import com.kotsin.surge.model.SignalDataPoint;
import com.kotsin.surge.model.SurgeContext;
import com.kotsin.surge.model.SurgeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * SurgeScanner - Walks a series chronologically and accumulates contiguous
 * above-threshold runs into surge events.
 *
 * A point is surging when BOTH hold:
 * - (count - mean) / stddev >= minStandardDeviations
 * - (count - mean) / max(mean, 1) * 100 >= minPercentageIncrease
 *
 * A zero standard deviation disables detection entirely.
 */
@Slf4j
@Component
public class SurgeScanner {

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_SUFFIX_LENGTH = 9;

    private final SurgeEventFinalizer finalizer;
    private final Clock clock;

    public SurgeScanner(SurgeEventFinalizer finalizer, Clock clock) {
        this.finalizer = finalizer;
        this.clock = clock;
    }

    /**
     * Detect surge events, sorted by standardDeviationsAbove descending.
     */
    public List<SurgeEvent> scan(List<SignalDataPoint> points, BaselineStats baseline,
                                 SurgeContext context, SurgeDetectorConfig config) {
        List<SurgeEvent> surges = new ArrayList<>();
        if (baseline.getStandardDeviation() == 0) {
            return surges;
        }

        Consumer<SurgeEvent> onClose = closed -> surges.add(finalizer.finalizeSurge(closed, baseline, context, config));

        ScanState state = ScanState.IDLE;
        for (SignalDataPoint point : points) {
            state = transition(state, point, baseline, config, onClose);
        }

        // Data ended mid-run
        if (state instanceof ScanState.Accumulating open) {
            SurgeEvent candidate = open.candidate();
            candidate.setEndTime(null);
            candidate.setOngoing(true);
            onClose.accept(candidate);
        }

        surges.sort(Comparator.comparingDouble(SurgeEvent::getStandardDeviationsAbove).reversed());
        return surges;
    }

    /**
     * Apply one data point to the scanner state.
     *
     * @param onClose receives a candidate closed by a non-surging point
     * @return the state after this point
     */
    ScanState transition(ScanState state, SignalDataPoint point, BaselineStats baseline,
                         SurgeDetectorConfig config, Consumer<SurgeEvent> onClose) {
        PointDeviation deviation = evaluate(point, baseline, config);

        if (deviation.surging()) {
            if (state instanceof ScanState.Accumulating open) {
                extend(open.candidate(), point, deviation);
                return new ScanState.Accumulating(open.candidate(), point.getTimestamp());
            }
            return new ScanState.Accumulating(open(point, baseline, deviation), point.getTimestamp());
        }

        if (state instanceof ScanState.Accumulating open) {
            SurgeEvent candidate = open.candidate();
            candidate.setEndTime(open.lastSurgingTime());
            candidate.setOngoing(false);
            onClose.accept(candidate);
        }
        return ScanState.IDLE;
    }

    PointDeviation evaluate(SignalDataPoint point, BaselineStats baseline, SurgeDetectorConfig config) {
        double mean = baseline.getMean();
        double stdDevsAbove = (point.getCount() - mean) / baseline.getStandardDeviation();
        double percentIncrease = ((point.getCount() - mean) / Math.max(mean, 1)) * 100;

        boolean surging = stdDevsAbove >= config.getMinStandardDeviations()
                && percentIncrease >= config.getMinPercentageIncrease();
        return new PointDeviation(stdDevsAbove, percentIncrease, surging);
    }

    private SurgeEvent open(SignalDataPoint point, BaselineStats baseline, PointDeviation deviation) {
        SurgeEvent candidate = SurgeEvent.builder()
                .id(nextId())
                .startTime(point.getTimestamp())
                .peakTime(point.getTimestamp())
                .peakValue(point.getCount())
                .baselineValue(baseline.getMean())
                .percentageIncrease(deviation.percentIncrease())
                .standardDeviationsAbove(deviation.stdDevsAbove())
                .ongoing(true)
                .build();
        addTags(candidate, point);
        log.debug("SURGE OPEN | id={} | start={} | value={} | stdDevs={}",
                candidate.getId(), point.getTimestamp(), point.getCount(),
                String.format("%.2f", deviation.stdDevsAbove()));
        return candidate;
    }

    private void extend(SurgeEvent candidate, SignalDataPoint point, PointDeviation deviation) {
        if (point.getCount() > candidate.getPeakValue()) {
            candidate.setPeakTime(point.getTimestamp());
            candidate.setPeakValue(point.getCount());
            candidate.setPercentageIncrease(deviation.percentIncrease());
            candidate.setStandardDeviationsAbove(deviation.stdDevsAbove());
        }
        addTags(candidate, point);
    }

    private void addTags(SurgeEvent candidate, SignalDataPoint point) {
        if (point.getSource() != null && !candidate.getAffectedSources().contains(point.getSource())) {
            candidate.getAffectedSources().add(point.getSource());
        }
        if (point.getIntent() != null && !candidate.getAffectedIntents().contains(point.getIntent())) {
            candidate.getAffectedIntents().add(point.getIntent());
        }
        if (point.getCompetitor() != null && !candidate.getRelatedCompetitors().contains(point.getCompetitor())) {
            candidate.getRelatedCompetitors().add(point.getCompetitor());
        }
    }

    private String nextId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(ID_SUFFIX_LENGTH);
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "surge-" + clock.millis() + "-" + suffix;
    }

    /**
     * Distance of one point from the baseline.
     */
    record PointDeviation(double stdDevsAbove, double percentIncrease, boolean surging) {
    }
}
