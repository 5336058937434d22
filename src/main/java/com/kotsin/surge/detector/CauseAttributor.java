package com.kotsin.surge.detector;

import com.kotsin.surge.model.IntentType;
import com.kotsin.surge.model.SeasonalPattern;
import com.kotsin.surge.model.SurgeContext;
import com.kotsin.surge.model.SurgeEvent;
import com.kotsin.surge.util.ValidationUtils;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * CauseAttributor - Identifies potential causes of a surge.
 *
 * Sources, in order:
 * 1. Recent news headlines matched against the cause rule table (one cause per headline)
 * 2. Related competitors
 * 3. Seasonal patterns covering the surge start month
 * 4. High-signal intents (competitor churn, compliance need)
 */
@Component
public class CauseAttributor {

    static final String CHURN_CAUSE = "Competitor churn activity";
    static final String COMPLIANCE_CAUSE = "Compliance/regulatory deadline";

    private final CauseRuleTable ruleTable;

    public CauseAttributor(CauseRuleTable ruleTable) {
        this.ruleTable = Objects.requireNonNull(ruleTable, "ruleTable cannot be null");
    }

    public CauseAttribution attribute(SurgeEvent surge, SurgeContext context) {
        Set<String> causes = new LinkedHashSet<>();
        boolean externallyDriven = false;

        if (context != null && context.getRecentNews() != null) {
            for (String news : context.getRecentNews()) {
                if (ValidationUtils.isNullOrEmpty(news)) continue;
                var match = ruleTable.firstMatch(news);
                if (match.isPresent()) {
                    causes.add(match.get());
                    externallyDriven = true;
                }
            }
        }

        if (!surge.getRelatedCompetitors().isEmpty()) {
            causes.add("Competitor activity: " + String.join(", ", surge.getRelatedCompetitors()));
        }

        int month = surge.getStartTime().atZone(ZoneOffset.UTC).getMonthValue();
        for (SeasonalPattern pattern : SeasonalPattern.values()) {
            if (pattern.contains(month)) {
                causes.add("Seasonal pattern: " + pattern.getPatternName());
            }
        }

        if (surge.getAffectedIntents().contains(IntentType.CHURN_FROM_COMPETITOR)) {
            causes.add(CHURN_CAUSE);
            externallyDriven = true;
        }
        if (surge.getAffectedIntents().contains(IntentType.COMPLIANCE_NEED)) {
            causes.add(COMPLIANCE_CAUSE);
            externallyDriven = true;
        }

        return new CauseAttribution(causes.stream().toList(), externallyDriven);
    }
}
