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
import java.util.Optional;

import lombok.Getter;

import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.series.SamplePoint;
import com.amazon.runqa.statistics.RobustStatistics;

/**
 * Per point acceptance checks: hard threshold bounds of the metric, when known,
 * and the distance from the global median of the measured values in units of
 * the robust sigma.
 */
@Getter
public class QualityChecker {

    public static final double DEFAULT_ROBUST_Z_TOLERANCE = 3.5;

    private final double robustZTolerance;

    public QualityChecker() {
        this(DEFAULT_ROBUST_Z_TOLERANCE);
    }

    public QualityChecker(double robustZTolerance) {
        checkArgument(robustZTolerance > 0, "tolerance must be positive");
        this.robustZTolerance = robustZTolerance;
    }

    public List<QualityStatus> check(MetricSeries series, Optional<ThresholdBounds> bounds) {
        checkNotNull(series, "series must not be null");
        checkNotNull(bounds, "bounds must not be null, use Optional.empty()");
        double[] measured = series.measuredValues();
        double median = RobustStatistics.median(measured);
        double robustSigma = RobustStatistics.robustSigma(measured);

        List<QualityStatus> result = new ArrayList<>(series.size());
        for (SamplePoint point : series.getPoints()) {
            if (!point.isMeasured()) {
                result.add(new QualityStatus(point.getRun(), point.getValue(), CheckStatus.PASS,
                        Collections.emptyList()));
                continue;
            }
            CheckStatus status = CheckStatus.PASS;
            List<String> reasons = new ArrayList<>(2);
            if (bounds.isPresent() && !bounds.get().contains(point.getValue())) {
                status = CheckStatus.FAIL;
                reasons.add(QualityStatus.THRESHOLD);
            }
            if (robustSigma > 0 && Math.abs(point.getValue() - median) / robustSigma > robustZTolerance) {
                if (status == CheckStatus.PASS) {
                    status = CheckStatus.WARN;
                }
                reasons.add(QualityStatus.ROBUST_Z);
            }
            result.add(new QualityStatus(point.getRun(), point.getValue(), status, reasons));
        }
        return Collections.unmodifiableList(result);
    }
}
