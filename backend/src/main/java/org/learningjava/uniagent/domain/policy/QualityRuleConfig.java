package org.learningjava.uniagent.domain.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class QualityRuleConfig {

    @JsonProperty("rules")
    private List<QualityRule> rules = new ArrayList<>();

    public List<QualityRule> getRules() {
        return rules;
    }

    public void setRules(List<QualityRule> rules) {
        this.rules = rules;
    }
}
