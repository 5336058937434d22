package com.kotsin.surge.analyzer;

import com.kotsin.surge.model.IntentType;
import com.kotsin.surge.model.SurgeEvent;
import com.kotsin.surge.model.SurgeSeverity;
import com.kotsin.surge.model.SurgeType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * RecommendationGenerator - Human-readable next step for a surge.
 *
 * Deterministic in (severity, type, isOngoing, affectedIntents, relatedCompetitors).
 */
@Component
public class RecommendationGenerator {

    public String generate(SurgeEvent surge) {
        SurgeSeverity severity = surge.getSeverity();
        SurgeType type = surge.getType();
        List<IntentType> intents = surge.getAffectedIntents();
        List<String> competitors = surge.getRelatedCompetitors();

        return switch (severity) {
            case CRITICAL -> critical(type, intents, competitors);
            case SIGNIFICANT -> surge.isOngoing()
                    ? "SIGNIFICANT: Active surge in progress. Monitor closely and prepare escalation plan. Brief sales team on opportunity."
                    : "SIGNIFICANT: Notable activity spike detected. Analyze root cause and adjust campaigns accordingly.";
            case MODERATE -> moderate(type);
            case MINOR -> "MINOR: Slight activity increase detected. Continue normal operations with enhanced monitoring.";
        };
    }

    private String critical(SurgeType type, List<IntentType> intents, List<String> competitors) {
        if (type == SurgeType.COMPETITOR_RELATED && !competitors.isEmpty()) {
            return "CRITICAL: Major competitor event (" + competitors.get(0) + "). Immediate competitive response required. "
                    + "Mobilize sales and marketing for displacement campaign.";
        }
        if (intents.contains(IntentType.CHURN_FROM_COMPETITOR)) {
            return "CRITICAL: Mass churn signal detected. Activate rapid response team. Prioritize outreach to high-value accounts.";
        }
        return "CRITICAL: Unprecedented activity spike. Investigate immediately and prepare response plan.";
    }

    private String moderate(SurgeType type) {
        if (type == SurgeType.SUSTAINED_TREND) {
            return "MODERATE: Sustained activity increase. Consider scaling content and outreach programs. "
                    + "This may indicate market shift.";
        }
        if (type == SurgeType.RECURRING_PATTERN) {
            return "MODERATE: Seasonal pattern detected. Optimize campaigns for expected increase. Pre-position resources.";
        }
        return "MODERATE: Above-normal activity. Continue monitoring and optimize high-performing channels.";
    }
}
