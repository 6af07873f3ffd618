package com.casegovernor.rules;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "governor.rules")
public record RuleProperties(List<RuleDefinition> definitions) {

    public RuleProperties {
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
    }
}
