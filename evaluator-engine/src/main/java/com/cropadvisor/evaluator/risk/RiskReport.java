package com.cropadvisor.evaluator.risk;

import com.cropadvisor.common.model.RiskFinding;

import java.util.List;

/**
 * @param findings         fired findings in rule-table order
 * @param weatherConsidered false when weather-dependent rules were skipped for lack of weather
 */
public record RiskReport(List<RiskFinding> findings, boolean weatherConsidered, String justification) {

    public RiskReport {
        findings = List.copyOf(findings);
    }
}
