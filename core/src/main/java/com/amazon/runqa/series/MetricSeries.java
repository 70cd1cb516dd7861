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

package com.amazon.runqa.series;

import static com.amazon.runqa.CommonUtils.checkArgument;
import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.amazon.runqa.statistics.RobustStatistics;

/**
 * The run-ordered measurements of a single metric. A series is immutable once
 * built, holds at least one point and at most one point per run.
 */
public class MetricSeries {

    @Getter
    private final String name;

    private final List<SamplePoint> points;

    private final int[] runs;

    protected MetricSeries(Builder builder) {
        checkArgument(!builder.points.isEmpty(), "series " + builder.name + " has no points");
        List<SamplePoint> sorted = new ArrayList<>(builder.points);
        sorted.sort(Comparator.comparingInt(SamplePoint::getRun));
        runs = new int[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            runs[i] = sorted.get(i).getRun();
            checkArgument(i == 0 || runs[i] != runs[i - 1],
                    "duplicate run " + runs[i] + " in series " + builder.name);
        }
        this.name = builder.name;
        this.points = Collections.unmodifiableList(sorted);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public int size() {
        return points.size();
    }

    public SamplePoint get(int index) {
        return points.get(index);
    }

    public List<SamplePoint> getPoints() {
        return points;
    }

    /**
     * @return the values in run order, NaN included
     */
    public double[] values() {
        double[] result = new double[points.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = points.get(i).getValue();
        }
        return result;
    }

    /**
     * @return the finite values in run order
     */
    public double[] finiteValues() {
        return RobustStatistics.finite(values());
    }

    /**
     * @return the values of the measured points (finite value, positive entries)
     *         in run order
     */
    public double[] measuredValues() {
        return points.stream().filter(SamplePoint::isMeasured).mapToDouble(SamplePoint::getValue).toArray();
    }

    public int[] runs() {
        return runs.clone();
    }

    /**
     * @param run a run identifier
     * @return the position of the run in the series, or a negative number if the
     *         run is absent
     */
    public int indexOfRun(int run) {
        int index = Arrays.binarySearch(runs, run);
        return (index >= 0) ? index : -1;
    }

    public Optional<SamplePoint> byRun(int run) {
        int index = indexOfRun(run);
        return (index >= 0) ? Optional.of(points.get(index)) : Optional.empty();
    }

    public static class Builder {

        private final String name;

        private final List<SamplePoint> points = new ArrayList<>();

        Builder(String name) {
            this.name = checkNotNull(name, "metric name must not be null");
        }

        public Builder add(SamplePoint point) {
            points.add(checkNotNull(point, "point must not be null"));
            return this;
        }

        public Builder add(int run, double value, double statErr, double entries) {
            return add(new SamplePoint(run, value, statErr, entries));
        }

        public Builder addAll(List<SamplePoint> list) {
            checkNotNull(list, "points must not be null").forEach(this::add);
            return this;
        }

        public boolean isEmpty() {
            return points.isEmpty();
        }

        public MetricSeries build() {
            return new MetricSeries(this);
        }
    }
}
