package com.casegovernor.rules;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuleConfiguration {

    @Bean
    public RuleSet ruleSet(RuleProperties properties) {
        return RuleSet.compile(properties.definitions());
    }

    @Bean
    public SlaPolicy slaPolicy(SlaProperties properties) {
        return SlaPolicy.from(properties);
    }
}
