package com.cropadvisor.evaluator.risk;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.RiskFinding;
import com.cropadvisor.common.risk.RiskInput;
import com.cropadvisor.common.risk.RiskRuleTable;
import com.cropadvisor.evaluator.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies the risk rule table to the crop's stage and the weather impact.
 * Runs after weather and crop stage; its input is assembled by the orchestrator.
 */
@Component
public class RiskEvaluator implements Evaluator<RiskInput, RiskReport> {

    private static final Logger log = LoggerFactory.getLogger(RiskEvaluator.class);

    private final RiskRuleTable ruleTable;

    public RiskEvaluator(RiskRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    @Override
    public EvaluatorId id() {
        return EvaluatorId.RISK;
    }

    @Override
    public Mono<RiskReport> evaluate(RiskInput input) {
        return Mono.fromCallable(() -> {
            List<RiskFinding> findings = ruleTable.evaluate(input);
            log.info("[RiskEvaluator] stage={} weather={} fired={}",
                     input.stage(), input.hasWeather(), findings.size());

            String justification = findings.isEmpty()
                ? "no risk rule fired for stage " + input.stage()
                : "rules fired: " + findings.stream()
                    .map(f -> f.ruleId() + " [" + f.triggeringCondition() + "]")
                    .collect(Collectors.joining("; "));
            if (!input.hasWeather()) {
                justification += " (weather-dependent rules skipped)";
            }
            return new RiskReport(findings, input.hasWeather(), justification);
        });
    }
}
