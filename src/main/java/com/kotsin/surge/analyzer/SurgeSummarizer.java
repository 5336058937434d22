package com.kotsin.surge.analyzer;

import com.kotsin.surge.model.IntentType;
import com.kotsin.surge.model.SurgeEvent;
import com.kotsin.surge.model.SurgeSeverity;
import com.kotsin.surge.model.SurgeSummary;
import com.kotsin.surge.model.SurgeType;
import com.kotsin.surge.util.MathUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * SurgeSummarizer - Aggregate counts and rankings over one analysis.
 *
 * Rankings count events, not points. Ties keep first-seen order.
 */
@Component
public class SurgeSummarizer {

    private static final int TOP_N = 5;

    public SurgeSummary summarize(List<SurgeEvent> surges) {
        if (surges.isEmpty()) {
            return SurgeSummary.empty();
        }

        int active = 0;
        int critical = 0;
        double totalHours = 0;
        for (SurgeEvent surge : surges) {
            if (surge.isOngoing()) active++;
            if (surge.getSeverity() == SurgeSeverity.CRITICAL) critical++;
            totalHours += surge.getDuration().getHours();
        }

        Map<SurgeType, Integer> typeCounts = countEach(surges, surge -> List.of(surge.getType()));
        Map<IntentType, Integer> intentCounts = countEach(surges, SurgeEvent::getAffectedIntents);
        Map<String, Integer> competitorCounts = countEach(surges, SurgeEvent::getRelatedCompetitors);

        return SurgeSummary.builder()
                .totalSurgesDetected(surges.size())
                .activeSurges(active)
                .criticalSurges(critical)
                .averageSurgeDuration(MathUtils.safeDivide(totalHours, surges.size(), 0.0))
                .mostCommonSurgeType(topKeys(typeCounts, 1).get(0))
                .topAffectedIntents(topKeys(intentCounts, TOP_N))
                .topRelatedCompetitors(topKeys(competitorCounts, TOP_N))
                .build();
    }

    private static <K> Map<K, Integer> countEach(List<SurgeEvent> surges,
                                                 Function<SurgeEvent, Collection<K>> keys) {
        Map<K, Integer> counts = new LinkedHashMap<>();
        for (SurgeEvent surge : surges) {
            for (K key : keys.apply(surge)) {
                counts.merge(key, 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Keys by count descending. List.sort is stable, so equal counts keep
     * insertion order.
     */
    private static <K> List<K> topKeys(Map<K, Integer> counts, int limit) {
        List<Map.Entry<K, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        List<K> top = new ArrayList<>();
        for (int i = 0; i < Math.min(limit, entries.size()); i++) {
            top.add(entries.get(i).getKey());
        }
        return top;
    }
}
