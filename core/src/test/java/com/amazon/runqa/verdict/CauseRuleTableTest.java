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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.Severity;

public class CauseRuleTableTest {

    private final CauseRuleTable table = CauseRuleTable.defaults();

    @ParameterizedTest
    @CsvSource({ "adc_peak, adc_level", "layer0_adc_median, adc_level", "adc_p90, adc_tail", "phi_chi2, phi_uniformity",
            "bco_peak, bco_timing", "cluster_size_mean, cluster_size", "cluster_phi_rms, cluster_phi_rms",
            "cluster_phi_mean, generic", "hits_asym, hit_asymmetry", "n_events, generic" })
    public void testFamilyOf(String metric, String family) {
        assertEquals(family, table.familyOf(metric).get().getName());
    }

    @Test
    public void testPhiDeadAndHotWithSpike() {
        List<String> causes = table.inferCauses("phi_uniform", AnomalyPattern.SPIKE, new CauseContext(0.2, 5.0, 2, 1));
        assertEquals(List.of(
                "2 dead ladder(s) creating azimuthal hole; 1 hot ladder(s) producing localized excess",
                "HV trip or recovery on INTT sensor module",
                "Beam position shift illuminating detector asymmetrically"), causes);
    }

    @Test
    public void testPhiHealthyDrift() {
        List<String> causes = table.inferCauses("phi_uniform", AnomalyPattern.GRADUAL_DRIFT,
                new CauseContext(0.2, 2.5, 0, 0));
        assertEquals(List.of("Progressive channel degradation affecting phi coverage"), causes);
    }

    @Test
    public void testPhiOnlyHot() {
        List<String> causes = table.inferCauses("phi_chi2", AnomalyPattern.SUSTAINED_SHIFT,
                new CauseContext(4.0, 3.0, 0, 4));
        assertEquals(List.of("4 hot ladder(s) producing localized excess",
                "Progressive channel degradation affecting phi coverage"), causes);
    }

    @Test
    public void testHitAsymmetry() {
        assertEquals(List.of("Severe occupancy imbalance: likely dead or hot sensor",
                "Confirmed: 3 dead ladder(s) in this run"),
                table.inferCauses("hits_asym", AnomalyPattern.SPIKE, new CauseContext(0.7, 6.0, 3, 0)));
        assertEquals(List.of("Severe occupancy imbalance: likely dead or hot sensor"),
                table.inferCauses("hits_asym", AnomalyPattern.SPIKE, new CauseContext(0.7, 6.0, 0, 0)));
        assertEquals(List.of("Moderate occupancy variation between sensors"),
                table.inferCauses("hits_asym", AnomalyPattern.ISOLATED_OUTLIER, new CauseContext(0.3, 2.5, 3, 0)));
    }

    @Test
    public void testAdcTailUsesSignOfZ() {
        assertEquals(2, table.inferCauses("adc_p90", AnomalyPattern.SPIKE, new CauseContext(900, 4.5, 0, 0)).size());
        assertEquals(List.of("Threshold adjustment cutting into signal tail"),
                table.inferCauses("adc_p90", AnomalyPattern.SPIKE, new CauseContext(100, -4.5, 0, 0)));
        // undefined z behaves as 0
        assertEquals(List.of("Threshold adjustment cutting into signal tail"),
                table.inferCauses("adc_p90", AnomalyPattern.SPIKE, new CauseContext(100, Double.NaN, 0, 0)));
    }

    @ParameterizedTest
    @CsvSource({ "3.5, 'Threshold set too low, capturing noise hits into clusters'",
            "1.2, 'Threshold set too high, splitting physical clusters'",
            "2.0, Normal variation in cluster formation" })
    public void testClusterSize(double value, String firstCause) {
        List<String> causes = table.inferCauses("cluster_size", AnomalyPattern.SPIKE, new CauseContext(value, 5, 0, 0));
        assertEquals(firstCause, causes.get(0));
    }

    @Test
    public void testAdcLevelByPattern() {
        CauseContext context = new CauseContext(50, 5, 0, 0);
        assertEquals("Calibration update applied between runs",
                table.inferCauses("adc_peak", AnomalyPattern.STEP_CHANGE, context).get(0));
        assertEquals("Temperature-dependent gain drift in INTT silicon sensors",
                table.inferCauses("adc_peak", AnomalyPattern.GRADUAL_DRIFT, context).get(0));
        assertEquals(List.of("Statistical fluctuation in ADC distribution sampling"),
                table.inferCauses("adc_peak", AnomalyPattern.STATISTICAL_FLUCTUATION, context));
    }

    @Test
    public void testNoDiagnosis() {
        CauseRuleTable custom = new CauseRuleTable(
                List.of(new CauseRuleFamily("only_spikes", List.of("x"), List.of(),
                        List.of(CauseRule.forPatterns(EnumSet.of(AnomalyPattern.SPIKE), "spiky")))),
                Collections.emptyList(), "nothing");
        CauseContext context = new CauseContext(1, 1, 0, 0);
        assertEquals(List.of("spiky"), custom.inferCauses("x", AnomalyPattern.SPIKE, context));
        assertEquals(List.of(CauseRuleTable.NO_DIAGNOSIS), custom.inferCauses("x", AnomalyPattern.STEP_CHANGE, context));
        assertEquals(List.of(CauseRuleTable.NO_DIAGNOSIS), custom.inferCauses("y", AnomalyPattern.SPIKE, context));
        assertEquals("nothing", custom.inferAction("x", AnomalyPattern.SPIKE, Severity.CRITICAL));
    }

    @Test
    public void testActions() {
        assertEquals("Flag run for timing review; alert trigger/timing group",
                table.inferAction("bco_peak", AnomalyPattern.SPIKE, Severity.CRITICAL));
        assertEquals("Run ladder health check; inspect phi distribution for this run",
                table.inferAction("phi_uniform", AnomalyPattern.SUSTAINED_SHIFT, Severity.CRITICAL));
        assertEquals("Flag run for exclusion from physics analysis; inspect raw histograms",
                table.inferAction("adc_peak", AnomalyPattern.STEP_CHANGE, Severity.CRITICAL));
        assertEquals("Monitor trend over next runs; check hardware logs for correlated changes",
                table.inferAction("bco_peak", AnomalyPattern.GRADUAL_DRIFT, Severity.WARNING));
        assertEquals("Check run logbook for calibration or hardware interventions near this run",
                table.inferAction("adc_peak", AnomalyPattern.STEP_CHANGE, Severity.WARNING));
        assertEquals("Note for review; compare with other metrics for correlated anomalies",
                table.inferAction("adc_peak", AnomalyPattern.SPIKE, Severity.WARNING));
        assertEquals(CauseRuleTable.DEFAULT_ACTION,
                table.inferAction("adc_peak", AnomalyPattern.ISOLATED_OUTLIER, Severity.INFO));
    }

    @Test
    public void testRuleCondition() {
        RuleCondition condition = RuleCondition.builder().valueAbove(1).valueAtMost(2).deadAtMost(0).build();
        assertTrue(condition.matches(new CauseContext(2, 0, 0, 5)));
        assertFalse(condition.matches(new CauseContext(1, 0, 0, 5)));
        assertFalse(condition.matches(new CauseContext(2, 0, 1, 5)));
        assertTrue(RuleCondition.ALWAYS.isAlways());
        assertFalse(condition.isAlways());
    }

    @Test
    public void testRender() {
        CauseContext context = new CauseContext(0.25, -1.5, 2, 7);
        assertEquals("2/7 at 0.250 (z -1.500)", context.render("{dead}/{hot} at {value} (z {z})"));
    }
}
