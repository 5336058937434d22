package com.kotsin.surge.config;

import com.kotsin.surge.detector.CauseRuleTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans shared by the detection pipeline.
 */
@Configuration
public class EngineConfig {

    /**
     * Wall clock for ongoing-surge durations and seasonal lookahead. UTC so
     * calendar-month bucketing does not depend on the host time zone.
     */
    @Bean
    public Clock surgeClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CauseRuleTable causeRuleTable() {
        return CauseRuleTable.defaults();
    }
}
