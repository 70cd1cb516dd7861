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

import static com.amazon.runqa.CommonUtils.checkArgument;
import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;

import com.amazon.runqa.anomalydetection.RobustOutlierDetector;
import com.amazon.runqa.anomalydetection.RobustStats;
import com.amazon.runqa.anomalydetection.ZScoreConvention;
import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.PatternClassifier;
import com.amazon.runqa.control.ControlChartEvaluator;
import com.amazon.runqa.control.ControlFlag;
import com.amazon.runqa.executor.AbstractAnalysisExecutor;
import com.amazon.runqa.executor.ParallelAnalysisExecutor;
import com.amazon.runqa.executor.SequentialAnalysisExecutor;
import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.symptom.RunSymptoms;
import com.amazon.runqa.symptom.SeverityThresholds;
import com.amazon.runqa.symptom.SymptomCluster;
import com.amazon.runqa.symptom.SymptomScorer;
import com.amazon.runqa.trend.Changepoint;
import com.amazon.runqa.trend.ChangepointDetector;
import com.amazon.runqa.trend.TrendAnalyzer;
import com.amazon.runqa.trend.TrendStats;
import com.amazon.runqa.verdict.CauseRuleTable;
import com.amazon.runqa.verdict.QualityChecker;
import com.amazon.runqa.verdict.QualityStatus;
import com.amazon.runqa.verdict.RunMetricVerdict;
import com.amazon.runqa.verdict.RunVerdict;
import com.amazon.runqa.verdict.SensorHealth;
import com.amazon.runqa.verdict.Verdict;
import com.amazon.runqa.verdict.ThresholdBounds;
import com.amazon.runqa.verdict.VerdictAggregator;

/**
 * Runs the full per metric analysis: local robust statistics, trend and
 * changepoint, control chart and quality checks, then verdicts per run. Metrics
 * are independent of each other, so {@link #analyzeAll} can fan them out over
 * a private thread pool; the report is identical either way.
 * <p>
 * An instance holds no mutable state and can be shared between threads.
 */
@Getter
public class RunQualityAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunQualityAnalyzer.class);

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final RobustOutlierDetector outlierDetector;

    private final TrendAnalyzer trendAnalyzer;

    private final ControlChartEvaluator controlChartEvaluator;

    private final QualityChecker qualityChecker;

    private final VerdictAggregator verdictAggregator;

    private final Optional<SymptomScorer> symptomScorer;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private final AbstractAnalysisExecutor executor;

    protected RunQualityAnalyzer(Builder builder) {
        outlierDetector = builder.outlierDetectorBuilder().build();
        trendAnalyzer = new TrendAnalyzer(new ChangepointDetector(builder.changepointStrongEvidence));
        controlChartEvaluator = new ControlChartEvaluator(builder.controlZThreshold, builder.cusumK, builder.cusumH);
        qualityChecker = new QualityChecker(builder.robustZTolerance);
        verdictAggregator = new VerdictAggregator(new PatternClassifier(), builder.ruleTable);
        symptomScorer = builder.symptomClusters.isEmpty() ? Optional.empty()
                : Optional.of(new SymptomScorer(builder.symptomClusters, builder.severityThresholds,
                        builder.metricSeverityThresholds));
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize.orElse(Runtime.getRuntime().availableProcessors() - 1);
            checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
            executor = new ParallelAnalysisExecutor(threadPoolSize);
        } else {
            threadPoolSize = 0;
            executor = new SequentialAnalysisExecutor();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * analyzes a single metric
     *
     * @param series       the series of the metric
     * @param bounds       hard acceptance range of the metric, if any
     * @param sensorHealth sensor context keyed by run, may be empty
     * @return the analysis, never null; degenerate data yields "no evidence"
     *         results rather than an exception
     */
    public MetricAnalysis analyze(MetricSeries series, Optional<ThresholdBounds> bounds,
            Map<Integer, SensorHealth> sensorHealth) {
        checkNotNull(series, "series must not be null");
        checkNotNull(bounds, "bounds must not be null");
        checkNotNull(sensorHealth, "sensor health must not be null");

        List<RobustStats> robustStats = outlierDetector.detect(series);
        TrendStats trendStats = trendAnalyzer.analyze(series, robustStats);
        List<ControlFlag> controlFlags = controlChartEvaluator.evaluate(series);
        List<QualityStatus> qualityStatuses = qualityChecker.check(series, bounds);
        List<RunMetricVerdict> verdicts = verdictAggregator.evaluate(series, robustStats, qualityStatuses,
                controlFlags, trendStats, sensorHealth);

        if (LOGGER.isDebugEnabled()) {
            long flagged = verdicts.stream().filter(v -> v.getPattern() != AnomalyPattern.NORMAL).count();
            LOGGER.debug("analyzed {}: {} points, {} measured, {} flagged", series.getName(), series.size(),
                    trendStats.getN(), flagged);
        }
        return new MetricAnalysis(series, robustStats, trendStats, controlFlags, qualityStatuses, verdicts);
    }

    public MetricAnalysis analyze(MetricSeries series) {
        return analyze(series, Optional.empty(), Collections.emptyMap());
    }

    /**
     * analyzes every metric and rolls the verdicts up by run
     *
     * @param seriesList     the metrics, in reporting order
     * @param boundsByMetric acceptance ranges keyed by metric name; a missing
     *                       metric has no range
     * @param sensorHealth   sensor context keyed by run, may be empty
     * @return the report
     */
    public QualityReport analyzeAll(List<MetricSeries> seriesList, Map<String, ThresholdBounds> boundsByMetric,
            Map<Integer, SensorHealth> sensorHealth) {
        checkNotNull(seriesList, "series list must not be null");
        checkNotNull(boundsByMetric, "bounds must not be null");
        checkNotNull(sensorHealth, "sensor health must not be null");

        List<MetricAnalysis> analyses = executor.map(seriesList,
                s -> analyze(s, Optional.ofNullable(boundsByMetric.get(s.getName())), sensorHealth));

        List<RunMetricVerdict> metricVerdicts = new ArrayList<>();
        analyses.forEach(a -> metricVerdicts.addAll(a.getVerdicts()));
        List<RunVerdict> runVerdicts = VerdictAggregator.rollup(metricVerdicts);
        List<RunSymptoms> symptoms = symptomScorer.map(scorer -> scorer.scoreRuns(zByRun(analyses)))
                .orElse(Collections.emptyList());

        LOGGER.info("analyzed {} metrics over {} runs: {} bad, {} suspect", analyses.size(), runVerdicts.size(),
                runVerdicts.stream().filter(v -> v.getVerdict() == Verdict.BAD).count(),
                runVerdicts.stream().filter(v -> v.getVerdict() == Verdict.SUSPECT).count());
        return new QualityReport(analyses, metricVerdicts, runVerdicts, symptoms);
    }

    static SortedMap<Integer, Map<String, Double>> zByRun(List<MetricAnalysis> analyses) {
        SortedMap<Integer, Map<String, Double>> result = new TreeMap<>();
        for (MetricAnalysis analysis : analyses) {
            MetricSeries series = analysis.getSeries();
            for (int i = 0; i < series.size(); i++) {
                result.computeIfAbsent(series.get(i).getRun(), r -> new HashMap<>()).put(series.getName(),
                        analysis.getRobustStats().get(i).getZLocal());
            }
        }
        return result;
    }

    public static class Builder {

        private int windowHalfWidth = RobustOutlierDetector.DEFAULT_WINDOW_HALF_WIDTH;
        private ZScoreConvention zScoreConvention = RobustOutlierDetector.DEFAULT_CONVENTION;
        private Optional<double[]> zThresholds = Optional.empty();
        private double changepointStrongEvidence = Changepoint.DEFAULT_STRONG_EVIDENCE;
        private double controlZThreshold = ControlChartEvaluator.DEFAULT_Z_THRESHOLD;
        private double cusumK = ControlChartEvaluator.DEFAULT_CUSUM_K;
        private double cusumH = ControlChartEvaluator.DEFAULT_CUSUM_H;
        private double robustZTolerance = QualityChecker.DEFAULT_ROBUST_Z_TOLERANCE;
        private CauseRuleTable ruleTable = CauseRuleTable.defaults();
        private List<SymptomCluster> symptomClusters = Collections.emptyList();
        private SeverityThresholds severityThresholds = SeverityThresholds.DEFAULT;
        private Map<String, SeverityThresholds> metricSeverityThresholds = Collections.emptyMap();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public Builder windowHalfWidth(int windowHalfWidth) {
            this.windowHalfWidth = windowHalfWidth;
            return this;
        }

        public Builder zScoreConvention(ZScoreConvention convention) {
            this.zScoreConvention = checkNotNull(convention, "convention must not be null");
            return this;
        }

        public Builder zThresholds(double weak, double strong) {
            this.zThresholds = Optional.of(new double[] { weak, strong });
            return this;
        }

        public Builder changepointStrongEvidence(double deltaBic) {
            this.changepointStrongEvidence = deltaBic;
            return this;
        }

        public Builder controlZThreshold(double controlZThreshold) {
            this.controlZThreshold = controlZThreshold;
            return this;
        }

        public Builder cusumK(double cusumK) {
            this.cusumK = cusumK;
            return this;
        }

        public Builder cusumH(double cusumH) {
            this.cusumH = cusumH;
            return this;
        }

        public Builder robustZTolerance(double robustZTolerance) {
            this.robustZTolerance = robustZTolerance;
            return this;
        }

        public Builder ruleTable(CauseRuleTable ruleTable) {
            this.ruleTable = checkNotNull(ruleTable, "rule table must not be null");
            return this;
        }

        public Builder symptomClusters(List<SymptomCluster> symptomClusters) {
            this.symptomClusters = checkNotNull(symptomClusters, "clusters must not be null");
            return this;
        }

        public Builder severityThresholds(SeverityThresholds severityThresholds) {
            this.severityThresholds = checkNotNull(severityThresholds, "thresholds must not be null");
            return this;
        }

        public Builder metricSeverityThresholds(Map<String, SeverityThresholds> metricSeverityThresholds) {
            this.metricSeverityThresholds = checkNotNull(metricSeverityThresholds, "thresholds must not be null");
            return this;
        }

        public Builder parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return this;
        }

        RobustOutlierDetector.Builder outlierDetectorBuilder() {
            RobustOutlierDetector.Builder detector = RobustOutlierDetector.builder().windowHalfWidth(windowHalfWidth)
                    .convention(zScoreConvention);
            zThresholds.ifPresent(t -> detector.thresholds(t[0], t[1]));
            return detector;
        }

        public RunQualityAnalyzer build() {
            return new RunQualityAnalyzer(this);
        }
    }
}
