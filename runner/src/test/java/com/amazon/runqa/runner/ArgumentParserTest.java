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

package com.amazon.runqa.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.runqa.anomalydetection.ZScoreConvention;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testDefaults() {
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getThresholdsPath().isPresent());
        assertFalse(parser.getSensorHealthPath().isPresent());
        assertFalse(parser.getCauseRulesPath().isPresent());
        assertFalse(parser.getSymptomClustersPath().isPresent());
        assertEquals(5, parser.getWindow());
        assertEquals(ZScoreConvention.LOCAL_MAD, parser.getZConvention());
        assertEquals(3.0, parser.getControlZ());
        assertEquals(0.5, parser.getCusumK());
        assertEquals(5.0, parser.getCusumH());
        assertEquals(ReportFormat.RUN_VERDICTS, parser.getReport());
        assertFalse(parser.getParallel());
        assertEquals(Optional.empty(), parser.getThreads());
    }

    @Test
    public void testParse() {
        parser.parse("-d", "|", "-t", "thresholds.csv", "--sensor-health", "health.csv", "--cause-rules",
                "rules.json", "--symptom-clusters", "clusters.csv", "-w", "3", "--z-convention",
                "pipeline_documented", "--control-z", "2.5", "--cusum-k", "0.25", "--cusum-h", "4", "-r", "markdown",
                "--parallel", "true", "--threads", "2");
        assertEquals("|", parser.getDelimiter());
        assertEquals(Optional.of(Paths.get("thresholds.csv")), parser.getThresholdsPath());
        assertEquals(Optional.of(Paths.get("health.csv")), parser.getSensorHealthPath());
        assertEquals(Optional.of(Paths.get("rules.json")), parser.getCauseRulesPath());
        assertEquals(Optional.of(Paths.get("clusters.csv")), parser.getSymptomClustersPath());
        assertEquals(3, parser.getWindow());
        assertEquals(ZScoreConvention.PIPELINE_DOCUMENTED, parser.getZConvention());
        assertEquals(2.5, parser.getControlZ());
        assertEquals(0.25, parser.getCusumK());
        assertEquals(4.0, parser.getCusumH());
        assertEquals(ReportFormat.MARKDOWN, parser.getReport());
        assertTrue(parser.getParallel());
        assertEquals(Optional.of(2), parser.getThreads());
    }

    @ParameterizedTest
    @EnumSource(ZScoreConvention.class)
    public void testParseConvention(ZScoreConvention convention) {
        assertEquals(convention, ArgumentParser.parseConvention(convention.name().toLowerCase()));
        assertEquals(convention, ArgumentParser.parseConvention(convention.name()));
    }

    @Test
    public void testUnknownConvention() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseConvention("median"));
    }

    @ParameterizedTest
    @EnumSource(ReportFormat.class)
    public void testReportLabels(ReportFormat format) {
        assertEquals(format, ReportFormat.fromLabel(format.getLabel()));
        assertTrue(ReportFormat.labels().contains(format.getLabel()));
    }

    @Test
    public void testUnknownReport() {
        assertThrows(IllegalArgumentException.class, () -> ReportFormat.fromLabel("html"));
    }
}
