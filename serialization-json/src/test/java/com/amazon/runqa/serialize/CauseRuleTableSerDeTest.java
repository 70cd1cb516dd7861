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

package com.amazon.runqa.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.Severity;
import com.amazon.runqa.verdict.CauseContext;
import com.amazon.runqa.verdict.CauseRuleTable;

public class CauseRuleTableSerDeTest {

    private CauseRuleTableSerDe serDe;

    @BeforeEach
    public void setUp() {
        serDe = new CauseRuleTableSerDe();
    }

    @ParameterizedTest
    @EnumSource(AnomalyPattern.class)
    public void testRoundTripPreservesInference(AnomalyPattern pattern) {
        CauseRuleTable original = CauseRuleTable.defaults();
        CauseRuleTable copy = serDe.fromJson(serDe.toJson(original));
        for (String metric : List.of("adc_peak", "adc_p90", "phi_uniform", "bco_peak", "cluster_size",
                "cluster_phi_rms", "hits_asym", "n_tracks")) {
            for (CauseContext context : List.of(new CauseContext(0.7, 4.5, 2, 1), new CauseContext(1.2, -3, 0, 0),
                    new CauseContext(3.5, 2.5, 0, 3))) {
                assertEquals(original.inferCauses(metric, pattern, context),
                        copy.inferCauses(metric, pattern, context));
            }
            for (Severity severity : Severity.values()) {
                assertEquals(original.inferAction(metric, pattern, severity),
                        copy.inferAction(metric, pattern, severity));
            }
        }
    }

    @Test
    public void testUnsetBoundsAreLeftOut() {
        String json = serDe.toJson(CauseRuleTable.defaults());
        assertTrue(json.contains("\"deadAbove\" : 0"));
        assertTrue(json.contains("\"localZAbove\" : 0.0"));
        assertFalse(json.contains("null"));
    }

    @Test
    public void testHandWrittenTable() throws IOException {
        CauseRuleTable table;
        try (InputStream in = CauseRuleTableSerDeTest.class.getResourceAsStream("custom-rules.json")) {
            table = serDe.fromJson(in);
        }
        assertEquals(List.of("Pickup on the readout cable", "2 dead channel(s) in run"),
                table.inferCauses("adc_gain", AnomalyPattern.SPIKE, new CauseContext(5, 6, 2, 0)));
        assertEquals(List.of(CauseRuleTable.NO_DIAGNOSIS),
                table.inferCauses("adc_gain", AnomalyPattern.STEP_CHANGE, new CauseContext(5, 6, 0, 0)));
        assertEquals(List.of(CauseRuleTable.NO_DIAGNOSIS),
                table.inferCauses("bco_peak", AnomalyPattern.SPIKE, new CauseContext(5, 6, 2, 0)));
        assertEquals("Page the gain expert", table.inferAction("adc_gain", AnomalyPattern.SPIKE, Severity.CRITICAL));
        assertEquals("Keep watching", table.inferAction("adc_gain", AnomalyPattern.SPIKE, Severity.WARNING));
    }

    @Test
    public void testFiles(@TempDir Path directory) {
        Path path = directory.resolve("rules.json");
        serDe.write(CauseRuleTable.defaults(), path);
        CauseRuleTable copy = serDe.read(path);
        assertEquals(CauseRuleTable.defaults().getFamilies(), copy.getFamilies());
        assertThrows(UncheckedIOException.class, () -> serDe.read(directory.resolve("missing.json")));
    }

    @Test
    public void testMalformedJson() {
        assertThrows(UncheckedIOException.class, () -> serDe.fromJson("{ \"families\": ["));
        assertThrows(UncheckedIOException.class, () -> serDe.fromJson("{ \"rulez\": [] }"));
        assertThrows(IllegalArgumentException.class,
                () -> serDe.fromJson("{ \"families\": [ { \"name\": \"x\", \"rules\": [ { \"patterns\": [\"wobble\"] } ] } ] }"));
    }
}
