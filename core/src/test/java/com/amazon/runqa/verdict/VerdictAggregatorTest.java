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

import static com.amazon.runqa.series.SeriesFixtures.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.amazon.runqa.anomalydetection.RobustOutlierDetector;
import com.amazon.runqa.anomalydetection.RobustStats;
import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.PatternClassifier;
import com.amazon.runqa.classify.Severity;
import com.amazon.runqa.control.ControlChartEvaluator;
import com.amazon.runqa.control.ControlFlag;
import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.testutils.ExampleSeriesData;
import com.amazon.runqa.trend.TrendAnalyzer;
import com.amazon.runqa.trend.TrendStats;

public class VerdictAggregatorTest {

    private List<RunMetricVerdict> evaluate(VerdictAggregator aggregator, MetricSeries series,
            Optional<ThresholdBounds> bounds, Map<Integer, SensorHealth> health) {
        List<RobustStats> robust = new RobustOutlierDetector().detect(series);
        TrendStats trend = new TrendAnalyzer().analyze(series, robust);
        List<ControlFlag> control = new ControlChartEvaluator().evaluate(series);
        List<QualityStatus> quality = new QualityChecker().check(series, bounds);
        return aggregator.evaluate(series, robust, quality, control, trend, health);
    }

    @Test
    public void testSpike() {
        MetricSeries series = series("adc_peak", ExampleSeriesData.spike());
        List<RunMetricVerdict> verdicts = evaluate(new VerdictAggregator(), series, Optional.empty(),
                Collections.emptyMap());
        assertEquals(7, verdicts.size());

        RunMetricVerdict spike = verdicts.get(3);
        assertEquals(4, spike.getRun());
        assertEquals(Verdict.BAD, spike.getVerdict());
        assertEquals(Severity.CRITICAL, spike.getSeverity());
        assertEquals(AnomalyPattern.SPIKE, spike.getPattern());
        assertEquals(List.of("Noisy run with electromagnetic pickup interference",
                "Beam conditions anomaly causing background spike"), spike.getCauses());
        assertEquals("Flag run for exclusion from physics analysis; inspect raw histograms", spike.getAction());
        assertEquals(100.0, spike.getValue());

        for (int i = 0; i < 3; i++) {
            assertEquals(Verdict.GOOD, verdicts.get(i).getVerdict());
            assertEquals(List.of(RunMetricVerdict.ALL_CHECKS_PASSED), verdicts.get(i).getCauses());
            assertEquals(RunMetricVerdict.NO_ACTION, verdicts.get(i).getAction());
            assertTrue(verdicts.get(i).isMeasured());
        }
        // the cumulative sum stays above its limit after the spike
        for (int i = 4; i < 7; i++) {
            assertEquals(Verdict.SUSPECT, verdicts.get(i).getVerdict());
            assertEquals(AnomalyPattern.STATISTICAL_FLUCTUATION, verdicts.get(i).getPattern());
            assertEquals(Severity.INFO, verdicts.get(i).getSeverity());
            assertEquals(CauseRuleTable.DEFAULT_ACTION, verdicts.get(i).getAction());
        }
    }

    @Test
    public void testSensorHealthFeedsCauses() {
        MetricSeries series = series("phi_uniform", ExampleSeriesData.spike());
        List<RunMetricVerdict> verdicts = evaluate(new VerdictAggregator(), series, Optional.empty(),
                Map.of(4, new SensorHealth(4, 2, 1, 56)));
        assertEquals("2 dead ladder(s) creating azimuthal hole; 1 hot ladder(s) producing localized excess",
                verdicts.get(3).getCauses().get(0));
        assertEquals(3, verdicts.get(3).getCauses().size());
        assertEquals("Run ladder health check; inspect phi distribution for this run", verdicts.get(3).getAction());
    }

    @Test
    public void testThresholdFailureIsBad() {
        MetricSeries series = series("adc_peak", ExampleSeriesData.constant(8, 5.0));
        List<RunMetricVerdict> verdicts = evaluate(new VerdictAggregator(), series,
                Optional.of(ThresholdBounds.atMost(4.0)), Collections.emptyMap());
        assertTrue(verdicts.stream().allMatch(v -> v.getVerdict() == Verdict.BAD));
        assertTrue(verdicts.stream().allMatch(v -> v.getSeverity() == Severity.CRITICAL));
    }

    @Test
    public void testUnflaggedPointsAreNotClassified() {
        PatternClassifier classifier = spy(new PatternClassifier());
        CauseRuleTable table = spy(CauseRuleTable.defaults());
        MetricSeries series = series("adc_peak", ExampleSeriesData.constant(10, 3.0));
        List<RunMetricVerdict> verdicts = evaluate(new VerdictAggregator(classifier, table), series,
                Optional.empty(), Collections.emptyMap());

        assertTrue(verdicts.stream().allMatch(v -> v.getVerdict() == Verdict.GOOD));
        verify(classifier, never()).classify(anyInt(), anyList(), any(TrendStats.class));
        verify(table, never()).inferCauses(anyString(), any(), any());
        verify(table, never()).inferAction(anyString(), any(), any());
    }

    @Test
    public void testFlaggedPointsAreClassifiedOnce() {
        PatternClassifier classifier = spy(new PatternClassifier());
        CauseRuleTable table = spy(CauseRuleTable.defaults());
        evaluate(new VerdictAggregator(classifier, table), series("adc_peak", ExampleSeriesData.spike()),
                Optional.empty(), Collections.emptyMap());
        // the spike and the three runs that follow it
        verify(classifier, times(4)).classify(anyInt(), anyList(), any(TrendStats.class));
        verify(table, times(4)).inferCauses(anyString(), any(), any());
    }

    @Test
    public void testUnmeasuredPoints() {
        MetricSeries series = series("adc_peak", ExampleSeriesData.allNaN(5));
        List<RunMetricVerdict> verdicts = evaluate(new VerdictAggregator(), series, Optional.empty(),
                Collections.emptyMap());
        assertTrue(verdicts.stream().allMatch(v -> v.getVerdict() == Verdict.GOOD));
        assertTrue(verdicts.stream().noneMatch(RunMetricVerdict::isMeasured));
    }

    @Test
    public void testEvidenceMustCoverSeries() {
        MetricSeries series = series("m", ExampleSeriesData.spike());
        List<RobustStats> robust = new RobustOutlierDetector().detect(series);
        TrendStats trend = new TrendAnalyzer().analyze(series);
        List<ControlFlag> control = new ControlChartEvaluator().evaluate(series);
        List<QualityStatus> quality = new QualityChecker().check(series, Optional.empty());
        assertThrows(IllegalArgumentException.class, () -> new VerdictAggregator().evaluate(series,
                robust.subList(0, 3), quality, control, trend, Collections.emptyMap()));
    }

    private static RunMetricVerdict verdict(int run, String metric, Verdict verdict) {
        if (verdict == Verdict.GOOD) {
            return RunMetricVerdict.good(run, metric, 0.0, 1.0, true);
        }
        return new RunMetricVerdict(run, metric, verdict,
                verdict == Verdict.BAD ? Severity.CRITICAL : Severity.INFO, AnomalyPattern.ISOLATED_OUTLIER,
                List.of("cause"), "action", 3.0, 1.0, true);
    }

    @Test
    public void testRollup() {
        List<RunVerdict> runs = VerdictAggregator.rollup(List.of(verdict(2, "a", Verdict.SUSPECT),
                verdict(2, "b", Verdict.BAD), verdict(2, "c", Verdict.BAD), verdict(1, "a", Verdict.GOOD),
                verdict(1, "b", Verdict.SUSPECT), verdict(1, "c", Verdict.SUSPECT), verdict(3, "a", Verdict.GOOD)));
        assertEquals(3, runs.size());

        RunVerdict first = runs.get(0);
        assertEquals(1, first.getRun());
        assertEquals(Verdict.SUSPECT, first.getVerdict());
        assertEquals(Optional.of("b"), first.getWorstMetric());
        assertEquals("1 good, 2 suspect, 0 bad (worst: b)", first.getSummary());

        RunVerdict second = runs.get(1);
        assertEquals(Verdict.BAD, second.getVerdict());
        assertEquals(Optional.of("b"), second.getWorstMetric());
        assertEquals(2, second.getNBad());
        assertEquals(1, second.getNSuspect());

        RunVerdict third = runs.get(2);
        assertEquals(Verdict.GOOD, third.getVerdict());
        assertFalse(third.getWorstMetric().isPresent());
        assertEquals("1 good, 0 suspect, 0 bad", third.getSummary());
    }

    @Test
    public void testRollupOfNothing() {
        assertTrue(VerdictAggregator.rollup(Collections.emptyList()).isEmpty());
    }
}
