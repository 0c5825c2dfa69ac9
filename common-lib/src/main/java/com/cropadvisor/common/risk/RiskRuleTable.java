package com.cropadvisor.common.risk;

import com.cropadvisor.common.model.IrrigationType;
import com.cropadvisor.common.model.RiskFinding;
import com.cropadvisor.common.model.Severity;
import com.cropadvisor.common.model.ThreatKind;
import com.cropadvisor.common.model.WaterNeed;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ordered, declarative risk rules. Every matching rule fires, in table order.
 *
 * <h3>Default table</h3>
 * <ol>
 *   <li>{@code flowering-heat}: flowering-class stage and heat stress risk at or above 0.6</li>
 *   <li>{@code general-heat}: any other stage with the same heat threshold</li>
 *   <li>{@code critical-water-stress}: irrigation needed at a stage whose water need is critical</li>
 *   <li>{@code rainfed-drought}: irrigation needed on a rainfed farm in vegetative growth</li>
 *   <li>{@code flowering-rain}: flowering-class stage with rain risk at or above 0.7</li>
 *   <li>{@code pre-harvest-rain}: maturity-class stage with rain risk at or above 0.5</li>
 *   <li>{@code early-pest-window}: 20 to 45 days after sowing in vegetative growth</li>
 *   <li>{@code spray-unsafe}: wind or rain makes spraying ineffective</li>
 * </ol>
 *
 * <p>Pure: {@code validUntil} derives from the input's {@code asOf}, never from a clock.
 */
public final class RiskRuleTable {

    public static final double HEAT_STRESS_THRESHOLD = 0.6;
    public static final double FLOWERING_RAIN_THRESHOLD = 0.7;
    public static final double PRE_HARVEST_RAIN_THRESHOLD = 0.5;
    public static final int PEST_WINDOW_START_DAY = 20;
    public static final int PEST_WINDOW_END_DAY = 45;

    private final List<RiskRule> rules;

    public RiskRuleTable(List<RiskRule> rules) {
        Set<String> ids = new HashSet<>();
        for (RiskRule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("duplicate risk rule id: " + rule.id());
            }
        }
        this.rules = List.copyOf(rules);
    }

    public List<RiskFinding> evaluate(RiskInput input) {
        List<RiskFinding> findings = new ArrayList<>();
        for (RiskRule rule : rules) {
            if (rule.matches(input)) {
                findings.add(rule.fire(input));
            }
        }
        return findings;
    }

    public List<RiskRule> rules() {
        return rules;
    }

    /** Position of a rule in the table, used as the tie-breaker when sorting findings. */
    public int orderOf(String ruleId) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).id().equals(ruleId)) return i;
        }
        return Integer.MAX_VALUE;
    }

    public static RiskRuleTable defaults() {
        return new RiskRuleTable(List.of(
            new RiskRule("flowering-heat", ThreatKind.HEAT_STRESS, Severity.HIGH, Duration.ofDays(3), true,
                in -> in.isFloweringClass() && in.impact().heatStressRisk() >= HEAT_STRESS_THRESHOLD,
                in -> "stage=" + in.stage() + " (flowering) heatStressRisk=" + fmt(in.impact().heatStressRisk())
                      + " >= " + HEAT_STRESS_THRESHOLD,
                "High temperatures during flowering can cause flower drop and poor grain set.",
                "Irrigate in the evening to cool the canopy and avoid midday field work."),

            new RiskRule("general-heat", ThreatKind.HEAT_STRESS, Severity.MEDIUM, Duration.ofDays(3), true,
                in -> !in.isFloweringClass() && in.impact().heatStressRisk() >= HEAT_STRESS_THRESHOLD,
                in -> "stage=" + in.stage() + " heatStressRisk=" + fmt(in.impact().heatStressRisk())
                      + " >= " + HEAT_STRESS_THRESHOLD,
                "Heat stress expected over the next few days.",
                "Irrigate early morning or evening and consider mulching."),

            new RiskRule("critical-water-stress", ThreatKind.WATER_STRESS, Severity.HIGH, Duration.ofDays(2), true,
                in -> in.impact().irrigationNeeded() && in.waterNeed() == WaterNeed.CRITICAL,
                in -> "irrigationNeeded=true waterNeed=critical stage=" + in.stage(),
                "No meaningful rain expected while the crop is at a critical water stage.",
                "Irrigate within the next 24 hours."),

            new RiskRule("rainfed-drought", ThreatKind.WATER_STRESS, Severity.MEDIUM, Duration.ofDays(2), true,
                in -> in.impact().irrigationNeeded()
                      && in.irrigationType() == IrrigationType.RAINFED
                      && in.isVegetativeClass(),
                in -> "irrigationNeeded=true irrigationType=rainfed stage=" + in.stage(),
                "Dry spell ahead for a rainfed crop in vegetative growth.",
                "Conserve soil moisture with mulching and plan protective irrigation if a source is available."),

            new RiskRule("flowering-rain", ThreatKind.DISEASE, Severity.MEDIUM, Duration.ofDays(2), true,
                in -> in.isFloweringClass() && in.impact().rainRisk() >= FLOWERING_RAIN_THRESHOLD,
                in -> "stage=" + in.stage() + " (flowering) rainRisk=" + fmt(in.impact().rainRisk())
                      + " >= " + FLOWERING_RAIN_THRESHOLD,
                "Heavy rain during flowering raises fungal disease risk.",
                "Inspect for blast and blight and keep drainage channels open."),

            new RiskRule("pre-harvest-rain", ThreatKind.DISEASE, Severity.MEDIUM, Duration.ofDays(2), true,
                in -> in.isMaturityClass() && in.impact().rainRisk() >= PRE_HARVEST_RAIN_THRESHOLD,
                in -> "stage=" + in.stage() + " (maturity) rainRisk=" + fmt(in.impact().rainRisk())
                      + " >= " + PRE_HARVEST_RAIN_THRESHOLD,
                "Rain expected close to harvest can cause lodging and grain damage.",
                "Harvest mature portions early and arrange covered storage."),

            new RiskRule("early-pest-window", ThreatKind.PEST, Severity.LOW, Duration.ofDays(7), false,
                in -> in.daysSinceSowing() >= PEST_WINDOW_START_DAY
                      && in.daysSinceSowing() <= PEST_WINDOW_END_DAY
                      && in.isVegetativeClass(),
                in -> "daysSinceSowing=" + in.daysSinceSowing() + " within ["
                      + PEST_WINDOW_START_DAY + ", " + PEST_WINDOW_END_DAY + "] stage=" + in.stage(),
                "Crop is in the early pest window.",
                "Scout the field twice a week for leaf damage and stem borers."),

            new RiskRule("spray-unsafe", ThreatKind.SPRAY_UNSAFE, Severity.LOW, Duration.ofDays(1), true,
                in -> !in.impact().spraySafe(),
                in -> "spraySafe=false rainRisk=" + fmt(in.impact().rainRisk()),
                "Wind or rain makes spraying ineffective today.",
                "Postpone pesticide and fertilizer sprays.")
        ));
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
