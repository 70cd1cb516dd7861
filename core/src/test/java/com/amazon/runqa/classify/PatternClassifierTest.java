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

package com.amazon.runqa.classify;

import static com.amazon.runqa.series.SeriesFixtures.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.amazon.runqa.anomalydetection.RobustOutlierDetector;
import com.amazon.runqa.anomalydetection.RobustStats;
import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.testutils.ExampleSeriesData;
import com.amazon.runqa.trend.Changepoint;
import com.amazon.runqa.trend.TrendAnalyzer;
import com.amazon.runqa.trend.TrendStats;

public class PatternClassifierTest {

    private final PatternClassifier classifier = new PatternClassifier();

    private static List<RobustStats> withZ(double... z) {
        List<RobustStats> stats = new ArrayList<>();
        for (double value : z) {
            if (Double.isNaN(value)) {
                stats.add(RobustStats.UNDEFINED);
            } else {
                double a = Math.abs(value);
                stats.add(new RobustStats(0, 1, value, a >= 2 && a < 3, a >= 3));
            }
        }
        return stats;
    }

    private static Optional<Changepoint> changepointAt(int index) {
        return Optional.of(new Changepoint(index, index + 1, 50, 50, true));
    }

    @Test
    public void testSpikeScenario() {
        MetricSeries series = series("m", ExampleSeriesData.spike());
        List<RobustStats> stats = new RobustOutlierDetector().detect(series);
        TrendStats trend = new TrendAnalyzer().analyze(series, stats);
        assertEquals(AnomalyPattern.SPIKE, classifier.classify(3, stats, trend));
        assertEquals(Severity.CRITICAL, AnomalyPattern.SPIKE.getSeverity());
    }

    @Test
    public void testStepScenario() {
        MetricSeries series = series("m", ExampleSeriesData.step(10, 10, 5.0, 8.0, 0.1));
        List<RobustStats> stats = new RobustOutlierDetector().detect(series);
        TrendStats trend = new TrendAnalyzer().analyze(series, stats);
        for (int i = 8; i <= 12; i++) {
            assertEquals(AnomalyPattern.STEP_CHANGE, classifier.classify(i, stats, trend));
        }
        assertEquals(AnomalyPattern.STATISTICAL_FLUCTUATION, classifier.classify(13, stats, trend));
    }

    @Test
    public void testChangepointTakesPrecedence() {
        List<RobustStats> stats = withZ(0, 0, 9, 0, 0);
        assertEquals(AnomalyPattern.STEP_CHANGE, classifier.classify(2, stats, 0.0, 1.0, changepointAt(4)));
        assertEquals(AnomalyPattern.SPIKE, classifier.classify(2, stats, 0.0, 1.0, Optional.empty()));
    }

    @Test
    public void testChangepointBeyondNeighborhood() {
        List<RobustStats> stats = withZ(0, 0, 0, 0, 2.5, 0);
        assertEquals(AnomalyPattern.ISOLATED_OUTLIER, classifier.classify(4, stats, 0.0, 1.0, changepointAt(1)));
    }

    @ParameterizedTest
    @CsvSource({ "1.0, 0.001, GRADUAL_DRIFT", "0.0, 0.001, SUSTAINED_SHIFT", "1.0, 0.5, SUSTAINED_SHIFT",
            "-0.2, 0.009, GRADUAL_DRIFT" })
    public void testFlaggedNeighbors(double slope, double pValue, AnomalyPattern expected) {
        List<RobustStats> stats = withZ(2.5, -2.1, 5.0, 0, 0);
        assertEquals(expected, classifier.classify(2, stats, slope, pValue, Optional.empty()));
    }

    @Test
    public void testOneFlaggedNeighborIsNotASpike() {
        List<RobustStats> stats = withZ(0, 2.5, 5.0, 0, 0);
        assertEquals(AnomalyPattern.ISOLATED_OUTLIER, classifier.classify(2, stats, 0.0, 1.0, Optional.empty()));
    }

    @Test
    public void testNeighborThresholdIsStrict() {
        List<RobustStats> stats = withZ(2.0, 2.0, 4.5, 2.0, 2.0);
        assertEquals(AnomalyPattern.SPIKE, classifier.classify(2, stats, 0.0, 1.0, Optional.empty()));
        assertEquals(AnomalyPattern.STATISTICAL_FLUCTUATION,
                classifier.classify(1, withZ(0, 2.0, 0), 0.0, 1.0, Optional.empty()));
    }

    @Test
    public void testUndefinedZCountsAsZero() {
        List<RobustStats> stats = withZ(Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        assertEquals(AnomalyPattern.STATISTICAL_FLUCTUATION,
                classifier.classify(2, stats, 1.0, 0.0, Optional.empty()));
    }

    @Test
    public void testSeverityMapping() {
        assertEquals(Severity.CRITICAL, AnomalyPattern.SPIKE.getSeverity());
        assertEquals(Severity.CRITICAL, AnomalyPattern.SUSTAINED_SHIFT.getSeverity());
        assertEquals(Severity.WARNING, AnomalyPattern.STEP_CHANGE.getSeverity());
        assertEquals(Severity.WARNING, AnomalyPattern.GRADUAL_DRIFT.getSeverity());
        assertEquals(Severity.INFO, AnomalyPattern.ISOLATED_OUTLIER.getSeverity());
        assertEquals(Severity.INFO, AnomalyPattern.STATISTICAL_FLUCTUATION.getSeverity());
        assertEquals(Severity.INFO, AnomalyPattern.NORMAL.getSeverity());
    }

    @Test
    public void testLabels() {
        assertEquals("step_change", AnomalyPattern.STEP_CHANGE.getLabel());
        assertEquals(AnomalyPattern.GRADUAL_DRIFT, AnomalyPattern.fromLabel("gradual_drift").get());
        assertEquals(AnomalyPattern.SPIKE, AnomalyPattern.fromLabel("SPIKE").get());
        assertEquals(Optional.empty(), AnomalyPattern.fromLabel("wobble"));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> classifier.classify(5, withZ(0, 0), 0.0, 1.0, Optional.empty()));
        assertThrows(IllegalArgumentException.class, () -> new PatternClassifier(0, 2, 4, 0.01, 2));
    }
}
