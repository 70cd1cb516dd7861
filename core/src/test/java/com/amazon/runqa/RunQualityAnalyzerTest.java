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

package com.amazon.runqa;

import static com.amazon.runqa.series.SeriesFixtures.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.Severity;
import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.symptom.ClusterLabel;
import com.amazon.runqa.symptom.RunSymptoms;
import com.amazon.runqa.symptom.SymptomCluster;
import com.amazon.runqa.testutils.ExampleSeriesData;
import com.amazon.runqa.testutils.NoisySeriesGenerator;
import com.amazon.runqa.trend.Changepoint;
import com.amazon.runqa.verdict.RunMetricVerdict;
import com.amazon.runqa.verdict.RunVerdict;
import com.amazon.runqa.verdict.ThresholdBounds;
import com.amazon.runqa.verdict.Verdict;

public class RunQualityAnalyzerTest {

    private final RunQualityAnalyzer analyzer = RunQualityAnalyzer.builder().build();

    @Test
    public void testSpike() {
        MetricAnalysis analysis = analyzer.analyze(series("adc_peak", ExampleSeriesData.spike()));
        assertEquals("adc_peak", analysis.getMetric());
        assertTrue(analysis.getRobustStats().get(3).isStrong());
        assertEquals(AnomalyPattern.SPIKE, analysis.getVerdicts().get(3).getPattern());
        assertEquals(Verdict.BAD, analysis.getVerdicts().get(3).getVerdict());
        assertTrue(analysis.getControlFlags().get(3).isShewhartOutOfControl());
        // the strong point does not take part in the changepoint search
        assertFalse(analysis.getTrendStats().getStrongChangepoint().isPresent());
    }

    @Test
    public void testLinearTrend() {
        MetricAnalysis analysis = analyzer.analyze(series("adc_median", ExampleSeriesData.linear(20, 0.1)));
        assertEquals(1.0, analysis.getTrendStats().getSlope().getAsDouble(), 1e-9);
        assertTrue(analysis.getTrendStats().hasSignificantTrend(0.01));

        List<RunMetricVerdict> verdicts = analysis.getVerdicts();
        assertEquals(Verdict.SUSPECT, verdicts.get(0).getVerdict());
        assertEquals(Verdict.SUSPECT, verdicts.get(19).getVerdict());
        assertEquals(AnomalyPattern.ISOLATED_OUTLIER, verdicts.get(0).getPattern());
        for (int i = 1; i < 19; i++) {
            assertEquals(Verdict.GOOD, verdicts.get(i).getVerdict(), "run " + (i + 1));
        }
    }

    @Test
    public void testStep() {
        MetricAnalysis analysis = analyzer.analyze(series("adc_peak", ExampleSeriesData.step(10, 10, 5.0, 8.0, 0.1)));
        Changepoint changepoint = analysis.getTrendStats().getStrongChangepoint().get();
        assertEquals(10, changepoint.getIndex());
        assertEquals(11, changepoint.getRun());
        assertTrue(analysis.getVerdicts().stream().allMatch(v -> v.getVerdict() == Verdict.GOOD));
    }

    @Test
    public void testStepBeyondThreshold() {
        MetricSeries series = series("adc_peak", ExampleSeriesData.step(10, 10, 5.0, 8.0, 0.1));
        MetricAnalysis analysis = analyzer.analyze(series, Optional.of(ThresholdBounds.atMost(7.0)),
                Collections.emptyMap());
        List<RunMetricVerdict> verdicts = analysis.getVerdicts();
        for (int i = 0; i < 10; i++) {
            assertEquals(Verdict.GOOD, verdicts.get(i).getVerdict());
        }
        for (int i = 10; i < 20; i++) {
            assertEquals(Verdict.BAD, verdicts.get(i).getVerdict());
            assertEquals(Severity.CRITICAL, verdicts.get(i).getSeverity());
        }
        RunMetricVerdict first = verdicts.get(10);
        assertEquals(AnomalyPattern.STEP_CHANGE, first.getPattern());
        assertEquals(List.of("Calibration update applied between runs",
                "Hardware swap (sensor module or FPHX chip replacement)"), first.getCauses());
        assertEquals("Flag run for exclusion from physics analysis; inspect raw histograms", first.getAction());
    }

    @Test
    public void testAllUnmeasured() {
        MetricAnalysis analysis = analyzer.analyze(series("adc_peak", ExampleSeriesData.allNaN(6)));
        assertEquals(0, analysis.getTrendStats().getN());
        assertTrue(Double.isNaN(analysis.getTrendStats().getMedian()));
        assertFalse(analysis.getTrendStats().getSlope().isPresent());
        assertEquals(1.0, analysis.getTrendStats().getPValue());
        assertFalse(analysis.getTrendStats().getChangepoint().isPresent());
        assertTrue(analysis.getVerdicts().stream().allMatch(v -> v.getVerdict() == Verdict.GOOD && !v.isMeasured()));
    }

    @Test
    public void testAnalyzeAll() {
        RunQualityAnalyzer withClusters = RunQualityAnalyzer.builder()
                .symptomClusters(List.of(new SymptomCluster("readout", List.of("adc_peak", "bco_peak")))).build();
        QualityReport report = withClusters.analyzeAll(
                List.of(series("adc_peak", ExampleSeriesData.spike()),
                        series("bco_peak", ExampleSeriesData.constant(7, 3.0))),
                Collections.emptyMap(), Collections.emptyMap());

        assertEquals(2, report.getAnalyses().size());
        assertEquals(14, report.getMetricVerdicts().size());
        assertEquals(7, report.getRunVerdicts().size());

        RunVerdict spikeRun = report.getRunVerdict(4).get();
        assertEquals(Verdict.BAD, spikeRun.getVerdict());
        assertEquals("1 good, 0 suspect, 1 bad (worst: adc_peak)", spikeRun.getSummary());
        assertEquals(Verdict.GOOD, report.getRunVerdict(1).get().getVerdict());
        assertEquals(Verdict.SUSPECT, report.getRunVerdict(5).get().getVerdict());
        assertFalse(report.getRunVerdict(99).isPresent());
        assertTrue(report.getAnalysis("bco_peak").isPresent());

        RunSymptoms symptoms = report.getSymptoms().get(3);
        assertEquals(4, symptoms.getRun());
        assertEquals(3, symptoms.getScores().get("readout"));
        assertEquals(ClusterLabel.MODERATE, symptoms.getLabel("readout"));
    }

    @Test
    public void testNoClustersNoSymptoms() {
        QualityReport report = analyzer.analyzeAll(List.of(series("adc_peak", ExampleSeriesData.spike())),
                Collections.emptyMap(), Collections.emptyMap());
        assertTrue(report.getSymptoms().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(longs = { 3L, 17L, 2024L })
    public void testParallelMatchesSequential(long seed) {
        NoisySeriesGenerator generator = new NoisySeriesGenerator(50.0, 2.0, 1.0);
        List<MetricSeries> seriesList = List.of(
                series("adc_peak", generator.generate(40, seed, 25, 8.0, new int[] { 7 }, 30.0)),
                series("phi_uniform", generator.generate(40, seed + 1)),
                series("bco_peak", generator.generate(40, seed + 2, 10, -6.0, new int[0], 0.0)),
                series("hits_asym", generator.generate(40, seed + 3)));
        Map<String, ThresholdBounds> bounds = Map.of("adc_peak", ThresholdBounds.of(40, 70));

        QualityReport sequential = analyzer.analyzeAll(seriesList, bounds, Collections.emptyMap());
        RunQualityAnalyzer parallel = RunQualityAnalyzer.builder().parallelExecutionEnabled(true).threadPoolSize(2)
                .build();
        QualityReport concurrent = parallel.analyzeAll(seriesList, bounds, Collections.emptyMap());

        assertEquals(sequential.getMetricVerdicts(), concurrent.getMetricVerdicts());
        assertEquals(sequential.getRunVerdicts(), concurrent.getRunVerdicts());
        assertEquals(2, parallel.getThreadPoolSize());
    }

    @Test
    public void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> RunQualityAnalyzer.builder().parallelExecutionEnabled(true).threadPoolSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> RunQualityAnalyzer.builder().cusumH(-1).build());
        assertThrows(IllegalArgumentException.class, () -> RunQualityAnalyzer.builder().windowHalfWidth(0).build());
    }
}
