/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.runqa.verdict;

import static com.amazon.runqa.CommonUtils.checkNotNull;
import static com.amazon.runqa.classify.AnomalyPattern.GRADUAL_DRIFT;
import static com.amazon.runqa.classify.AnomalyPattern.SPIKE;
import static com.amazon.runqa.classify.AnomalyPattern.STEP_CHANGE;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.Severity;

/**
 * Data driven mapping from (metric, pattern, context) to an ordered list of
 * plausible causes, and from (metric, pattern, severity) to a recommended
 * action. The first family that applies to a metric supplies its causes; the
 * first action rule that matches supplies the action.
 */
@Getter
public class CauseRuleTable {

    public static final String NO_DIAGNOSIS = "No specific diagnosis available";

    public static final String DEFAULT_ACTION = "No action needed; within expected variation";

    private final List<CauseRuleFamily> families;

    private final List<ActionRule> actionRules;

    private final String defaultAction;

    public CauseRuleTable(List<CauseRuleFamily> families, List<ActionRule> actionRules, String defaultAction) {
        this.families = List.copyOf(checkNotNull(families, "families must not be null"));
        this.actionRules = List.copyOf(checkNotNull(actionRules, "action rules must not be null"));
        this.defaultAction = checkNotNull(defaultAction, "default action must not be null");
    }

    public Optional<CauseRuleFamily> familyOf(String metric) {
        return families.stream().filter(f -> f.appliesTo(metric)).findFirst();
    }

    public List<String> inferCauses(String metric, AnomalyPattern pattern, CauseContext context) {
        checkNotNull(metric, "metric must not be null");
        List<String> causes = familyOf(metric).map(f -> f.infer(pattern, context)).orElse(Collections.emptyList());
        return causes.isEmpty() ? List.of(NO_DIAGNOSIS) : List.copyOf(causes);
    }

    public String inferAction(String metric, AnomalyPattern pattern, Severity severity) {
        checkNotNull(metric, "metric must not be null");
        return actionRules.stream().filter(r -> r.matches(metric, pattern, severity)).map(ActionRule::getAction)
                .findFirst().orElse(defaultAction);
    }

    /**
     * @return the rule table of the silicon tracker metrics, ending in a generic
     *         family that matches any other metric
     */
    public static CauseRuleTable defaults() {
        List<CauseRuleFamily> families = List.of(
                new CauseRuleFamily("adc_level", List.of("adc_peak", "adc_median"), List.of(), List.of(
                        CauseRule.forPatterns(EnumSet.of(GRADUAL_DRIFT),
                                "Temperature-dependent gain drift in INTT silicon sensors",
                                "Gradual radiation damage affecting charge collection"),
                        CauseRule.forPatterns(EnumSet.of(STEP_CHANGE), "Calibration update applied between runs",
                                "Hardware swap (sensor module or FPHX chip replacement)"),
                        CauseRule.forPatterns(EnumSet.of(SPIKE), "Noisy run with electromagnetic pickup interference",
                                "Beam conditions anomaly causing background spike"),
                        CauseRule.always("Statistical fluctuation in ADC distribution sampling"))),
                new CauseRuleFamily("adc_tail", List.of("adc_p90"), List.of(), List.of(
                        CauseRule.when(RuleCondition.builder().zAbove(0).build(),
                                "Growing electronic noise or crosstalk between channels",
                                "Beam background increase filling high-ADC bins"),
                        CauseRule.always("Threshold adjustment cutting into signal tail"))),
                new CauseRuleFamily("phi_uniformity", List.of("phi_uniform", "phi_chi2"), List.of(), List.of(
                        CauseRule.when(RuleCondition.builder().deadAbove(0).hotAbove(0).build(),
                                "{dead} dead ladder(s) creating azimuthal hole; "
                                        + "{hot} hot ladder(s) producing localized excess")
                                .thenContinue(),
                        CauseRule.when(RuleCondition.builder().deadAbove(0).hotAtMost(0).build(),
                                "{dead} dead ladder(s) creating azimuthal hole").thenContinue(),
                        CauseRule.when(RuleCondition.builder().deadAtMost(0).hotAbove(0).build(),
                                "{hot} hot ladder(s) producing localized excess").thenContinue(),
                        CauseRule.forPatterns(EnumSet.of(SPIKE, STEP_CHANGE),
                                "HV trip or recovery on INTT sensor module",
                                "Beam position shift illuminating detector asymmetrically"),
                        CauseRule.always("Progressive channel degradation affecting phi coverage"))),
                new CauseRuleFamily("bco_timing", List.of("bco_peak"), List.of(), List.of(
                        CauseRule.forPatterns(EnumSet.of(STEP_CHANGE, SPIKE),
                                "Normal BCO phase toggling between two states (may be expected)",
                                "DAQ timing reconfiguration"),
                        CauseRule.forPatterns(EnumSet.of(GRADUAL_DRIFT), "Clock oscillator frequency drift",
                                "PLL instability in INTT readout timing chain"),
                        CauseRule.always("Timing jitter or synchronization fluctuation"))),
                new CauseRuleFamily("cluster_size", List.of("cluster_size"), List.of(), List.of(
                        CauseRule.when(RuleCondition.builder().valueAbove(3.0).build(),
                                "Threshold set too low, capturing noise hits into clusters",
                                "Increasing electronic noise widening clusters"),
                        CauseRule.when(RuleCondition.builder().valueBelow(1.5).build(),
                                "Threshold set too high, splitting physical clusters",
                                "Gain decrease reducing signal-to-noise ratio"),
                        CauseRule.always("Normal variation in cluster formation"))),
                new CauseRuleFamily("cluster_phi_rms", List.of("cluster_phi"), List.of("rms"), List.of(
                        CauseRule.always("Change in active azimuthal coverage (dead/recovered sectors)",
                                "Beam position shift affecting illumination pattern"))),
                new CauseRuleFamily("hit_asymmetry", List.of("hits_asym"), List.of(), List.of(
                        CauseRule.when(RuleCondition.builder().valueAbove(0.5).build(),
                                "Severe occupancy imbalance: likely dead or hot sensor").thenContinue(),
                        CauseRule.when(RuleCondition.builder().valueAbove(0.5).deadAbove(0).build(),
                                "Confirmed: {dead} dead ladder(s) in this run"),
                        CauseRule.when(RuleCondition.builder().valueAtMost(0.5).build(),
                                "Moderate occupancy variation between sensors"))),
                new CauseRuleFamily("generic", List.of(), List.of(), List.of(
                        CauseRule.always("Anomalous value detected; manual inspection recommended"))));

        List<ActionRule> actions = List.of(
                new ActionRule(EnumSet.of(Severity.CRITICAL), Collections.emptySet(), List.of("bco"),
                        "Flag run for timing review; alert trigger/timing group"),
                new ActionRule(EnumSet.of(Severity.CRITICAL), Collections.emptySet(), List.of("phi"),
                        "Run ladder health check; inspect phi distribution for this run"),
                new ActionRule(EnumSet.of(Severity.CRITICAL), Collections.emptySet(), List.of(),
                        "Flag run for exclusion from physics analysis; inspect raw histograms"),
                new ActionRule(EnumSet.of(Severity.WARNING), EnumSet.of(GRADUAL_DRIFT), List.of(),
                        "Monitor trend over next runs; check hardware logs for correlated changes"),
                new ActionRule(EnumSet.of(Severity.WARNING), EnumSet.of(STEP_CHANGE), List.of(),
                        "Check run logbook for calibration or hardware interventions near this run"),
                new ActionRule(EnumSet.of(Severity.WARNING), Collections.emptySet(), List.of(),
                        "Note for review; compare with other metrics for correlated anomalies"));

        return new CauseRuleTable(families, actions, DEFAULT_ACTION);
    }
}
