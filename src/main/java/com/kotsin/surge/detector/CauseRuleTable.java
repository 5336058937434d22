package com.kotsin.surge.detector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered table of known external events that could cause surges.
 * The first matching rule wins for a given headline.
 */
public final class CauseRuleTable {

    private final List<CauseRule> rules;

    public CauseRuleTable(List<CauseRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static CauseRuleTable defaults() {
        return new CauseRuleTable(List.of(
                CauseRule.of("product\\s+hunt", "Product Hunt launch"),
                CauseRule.of("techcrunch|ycombinator|hacker\\s*news", "Tech press coverage"),
                CauseRule.of("funding|series\\s+[a-z]|raised", "Funding announcement"),
                CauseRule.of("acquisition|acquired|merger", "M&A activity"),
                CauseRule.of("outage|downtime|incident", "Service outage"),
                CauseRule.of("security|breach|vulnerability", "Security incident"),
                CauseRule.of("price\\s+(?:increase|change|hike)", "Pricing change"),
                CauseRule.of("layoff|restructur", "Company restructuring"),
                CauseRule.of("conference|event|summit", "Industry event"),
                CauseRule.of("regulation|compliance|gdpr|law", "Regulatory change")
        ));
    }

    /**
     * New table with an extra rule appended after the existing ones.
     */
    public CauseRuleTable with(CauseRule rule) {
        List<CauseRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new CauseRuleTable(extended);
    }

    public Optional<String> firstMatch(String headline) {
        for (CauseRule rule : rules) {
            if (rule.matches(headline)) {
                return Optional.of(rule.cause());
            }
        }
        return Optional.empty();
    }

    public int size() {
        return rules.size();
    }
}
