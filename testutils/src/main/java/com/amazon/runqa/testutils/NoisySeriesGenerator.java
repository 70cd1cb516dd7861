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

import java.util.Random;

/**
 * Generates a Gaussian series around a base level, with optional spikes and a
 * level shift. The generator is seeded so that a test sees the same data on
 * every run.
 */
public class NoisySeriesGenerator {

    private final double level;
    private final double sigma;
    private final double statErr;

    public NoisySeriesGenerator(double level, double sigma, double statErr) {
        this.level = level;
        this.sigma = sigma;
        this.statErr = statErr;
    }

    public double[][] generate(int size, long seed) {
        return generate(size, seed, -1, 0.0, new int[0], 0.0);
    }

    /**
     * @param size       number of runs
     * @param seed       random seed
     * @param shiftIndex position from which the level is shifted, negative for
     *                   none
     * @param shift      size of the level shift
     * @param spikes     positions that receive a spike
     * @param spikeSize  size of the spikes
     * @return rows of {run, value, statErr, entries}
     */
    public double[][] generate(int size, long seed, int shiftIndex, double shift, int[] spikes, double spikeSize) {
        Random prg = new Random(seed);
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = level + sigma * prg.nextGaussian();
            if (shiftIndex >= 0 && i >= shiftIndex) {
                values[i] += shift;
            }
        }
        for (int s : spikes) {
            values[s] += spikeSize;
        }
        return ExampleSeriesData.fromValues(values, statErr, 100);
    }
}
