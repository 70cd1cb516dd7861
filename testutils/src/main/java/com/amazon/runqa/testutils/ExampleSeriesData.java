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

package com.amazon.runqa.testutils;

import java.util.Arrays;

/**
 * Small hand made series. Every row is {@code {run, value, statErr, entries}};
 * runs start at 1.
 */
public class ExampleSeriesData {

    public static final int RUN = 0;
    public static final int VALUE = 1;
    public static final int STAT_ERR = 2;
    public static final int ENTRIES = 3;

    private ExampleSeriesData() {
    }

    public static double[][] fromValues(double[] values, double statErr, double entries) {
        double[][] rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            rows[i] = new double[] { i + 1, values[i], statErr, entries };
        }
        return rows;
    }

    /**
     * seven runs at 10 with a single excursion to 100 at run 4
     */
    public static double[][] spike() {
        return fromValues(new double[] { 10, 10, 10, 100, 10, 10, 10 }, 1, 100);
    }

    /**
     * value equal to the run number
     */
    public static double[][] linear(int size, double statErr) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = i + 1;
        }
        return fromValues(values, statErr, 100);
    }

    /**
     * {@code before} runs at {@code low} followed by {@code after} runs at
     * {@code high}
     */
    public static double[][] step(int before, int after, double low, double high, double statErr) {
        double[] values = new double[before + after];
        Arrays.fill(values, 0, before, low);
        Arrays.fill(values, before, before + after, high);
        return fromValues(values, statErr, 100);
    }

    public static double[][] constant(int size, double value) {
        double[] values = new double[size];
        Arrays.fill(values, value);
        return fromValues(values, 1, 100);
    }

    public static double[][] allNaN(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return fromValues(values, 1, 0);
    }
}
