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

import static com.amazon.runqa.CommonUtils.checkArgument;
import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import lombok.Getter;

import com.amazon.runqa.anomalydetection.RobustStats;
import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.PatternClassifier;
import com.amazon.runqa.classify.Severity;
import com.amazon.runqa.control.ControlFlag;
import com.amazon.runqa.control.ControlStatus;
import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.series.SamplePoint;
import com.amazon.runqa.trend.TrendStats;

/**
 * Turns the evidence gathered for a metric into one verdict per run, and folds
 * the verdicts of all metrics into one verdict per run.
 * <p>
 * A point is flagged by a weak or strong local outlier, a WARN or FAIL quality
 * status or a WARN from the control chart. It is severe, hence BAD and
 * critical, for a strong local outlier, a quality FAIL or a Shewhart
 * violation. Only flagged points are classified and diagnosed.
 */
@Getter
public class VerdictAggregator {

    private final PatternClassifier classifier;

    private final CauseRuleTable ruleTable;

    public VerdictAggregator() {
        this(new PatternClassifier(), CauseRuleTable.defaults());
    }

    public VerdictAggregator(PatternClassifier classifier, CauseRuleTable ruleTable) {
        this.classifier = checkNotNull(classifier, "classifier must not be null");
        this.ruleTable = checkNotNull(ruleTable, "rule table must not be null");
    }

    public List<RunMetricVerdict> evaluate(MetricSeries series, List<RobustStats> robustStats,
            List<QualityStatus> quality, List<ControlFlag> control, TrendStats trend,
            Map<Integer, SensorHealth> sensorHealth) {
        checkNotNull(series, "series must not be null");
        checkNotNull(trend, "trend must not be null");
        checkNotNull(sensorHealth, "sensor health must not be null, use an empty map");
        int n = series.size();
        checkArgument(robustStats.size() == n && quality.size() == n && control.size() == n,
                "evidence must cover every point of the series");

        List<RunMetricVerdict> verdicts = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            SamplePoint point = series.get(i);
            RobustStats robust = robustStats.get(i);
            QualityStatus status = quality.get(i);
            ControlFlag flag = control.get(i);

            boolean flagged = robust.isFlagged() || status.getStatus() != CheckStatus.PASS
                    || flag.getStatus() == ControlStatus.WARN;
            boolean severe = robust.isStrong() || status.getStatus() == CheckStatus.FAIL
                    || flag.isShewhartOutOfControl();

            if (!flagged) {
                verdicts.add(RunMetricVerdict.good(point.getRun(), series.getName(), robust.getZLocal(),
                        point.getValue(), point.isMeasured()));
                continue;
            }
            AnomalyPattern pattern = classifier.classify(i, robustStats, trend);
            Severity severity = severe ? Severity.CRITICAL : pattern.getSeverity();
            Verdict verdict = severe ? Verdict.BAD : Verdict.SUSPECT;

            Optional<SensorHealth> health = Optional.ofNullable(sensorHealth.get(point.getRun()));
            CauseContext context = new CauseContext(point.getValue(), robust.getZLocal(),
                    health.map(SensorHealth::getDeadCount).orElse(0), health.map(SensorHealth::getHotCount).orElse(0));
            List<String> causes = ruleTable.inferCauses(series.getName(), pattern, context);
            String action = ruleTable.inferAction(series.getName(), pattern, severity);
            verdicts.add(new RunMetricVerdict(point.getRun(), series.getName(), verdict, severity, pattern, causes,
                    action, robust.getZLocal(), point.getValue(), point.isMeasured()));
        }
        return Collections.unmodifiableList(verdicts);
    }

    /**
     * Folds verdicts by run. The worst metric of a run is the first BAD metric in
     * the order given, or the first SUSPECT one when nothing is BAD.
     *
     * @param verdicts verdicts of any number of metrics
     * @return one verdict per run, ascending by run
     */
    public static List<RunVerdict> rollup(List<RunMetricVerdict> verdicts) {
        checkNotNull(verdicts, "verdicts must not be null");
        Map<Integer, int[]> counts = new TreeMap<>();
        Map<Integer, String> firstBad = new TreeMap<>();
        Map<Integer, String> firstSuspect = new TreeMap<>();
        for (RunMetricVerdict v : verdicts) {
            int[] c = counts.computeIfAbsent(v.getRun(), r -> new int[3]);
            c[v.getVerdict().ordinal()]++;
            if (v.getVerdict() == Verdict.BAD) {
                firstBad.putIfAbsent(v.getRun(), v.getMetric());
            } else if (v.getVerdict() == Verdict.SUSPECT) {
                firstSuspect.putIfAbsent(v.getRun(), v.getMetric());
            }
        }
        List<RunVerdict> result = new ArrayList<>(counts.size());
        for (Map.Entry<Integer, int[]> entry : counts.entrySet()) {
            int run = entry.getKey();
            int[] c = entry.getValue();
            Optional<String> worst = Optional.ofNullable(firstBad.getOrDefault(run, firstSuspect.get(run)));
            result.add(new RunVerdict(run, c[Verdict.GOOD.ordinal()], c[Verdict.SUSPECT.ordinal()],
                    c[Verdict.BAD.ordinal()], worst));
        }
        return Collections.unmodifiableList(result);
    }
}
