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

package com.amazon.runqa.trend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class WeightedLinearFitTest {

    @Test
    public void testHandComputedFit() {
        double[] x = { 0, 1, 2, 3 };
        double[] y = { 0, 1, 1, 2 };
        double[] w = { 1, 1, 1, 1 };
        WeightedLinearFit fit = WeightedLinearFit.fit(x, y, w);
        assertEquals(0.6, fit.getSlope().getAsDouble(), 1e-12);
        assertEquals(0.1, fit.getIntercept().getAsDouble(), 1e-12);
        assertEquals(0.2, fit.getWeightedSse(), 1e-12);
        // residual variance 0.2 / 2, slope variance 0.1 * 4 / 20
        assertEquals(Math.sqrt(0.02), fit.getSlopeError().getAsDouble(), 1e-12);
        // |b / eb| = 3 sqrt(2), hence p = erfc(3)
        assertEquals(2.209049699858544e-5, fit.getPValue(), 1e-12);
    }

    @Test
    public void testDownWeightedPointPullsLess() {
        double[] x = { 0, 1, 2, 3 };
        double[] y = { 0, 0, 0, 3 };
        WeightedLinearFit even = WeightedLinearFit.fit(x, y, new double[] { 1, 1, 1, 1 });
        WeightedLinearFit weighted = WeightedLinearFit.fit(x, y, new double[] { 100, 100, 100, 1 });
        assertEquals(0.9, even.getSlope().getAsDouble(), 1e-12);
        assertEquals(1800.0 / 61400.0, weighted.getSlope().getAsDouble(), 1e-12);
    }

    @Test
    public void testExactLine() {
        double[] x = new double[10];
        double[] y = new double[10];
        double[] w = new double[10];
        for (int i = 0; i < 10; i++) {
            x[i] = i + 1;
            y[i] = 2 + 3 * x[i];
        }
        Arrays.fill(w, 100);
        WeightedLinearFit fit = WeightedLinearFit.fit(x, y, w);
        assertEquals(3.0, fit.getSlope().getAsDouble(), 1e-9);
        assertEquals(2.0, fit.getIntercept().getAsDouble(), 1e-9);
        assertTrue(fit.getPValue() < 1e-6);
    }

    @Test
    public void testExactFlatLine() {
        WeightedLinearFit fit = WeightedLinearFit.fit(new double[] { 1, 2, 3, 4 }, new double[] { 4, 4, 4, 4 },
                new double[] { 1, 1, 1, 1 });
        assertEquals(0.0, fit.getSlope().getAsDouble());
        assertEquals(0.0, fit.getSlopeError().getAsDouble());
        assertEquals(1.0, fit.getPValue());
    }

    @Test
    public void testDegenerateInput() {
        WeightedLinearFit single = WeightedLinearFit.fit(new double[] { 3 }, new double[] { 1 }, new double[] { 1 });
        assertTrue(single.isDegenerate());
        assertFalse(single.getSlopeError().isPresent());
        assertEquals(1.0, single.getPValue());

        WeightedLinearFit vertical = WeightedLinearFit.fit(new double[] { 2, 2, 2 }, new double[] { 1, 2, 3 },
                new double[] { 1, 1, 1 });
        assertTrue(vertical.isDegenerate());
        assertEquals(1.0, vertical.getPValue());

        assertTrue(WeightedLinearFit.fit(new double[0], new double[0], new double[0]).isDegenerate());
    }

    @Test
    public void testInvalidInput() {
        assertThrows(IllegalArgumentException.class,
                () -> WeightedLinearFit.fit(new double[2], new double[3], new double[2]));
        assertThrows(NullPointerException.class, () -> WeightedLinearFit.fit(null, new double[0], new double[0]));
    }
}
