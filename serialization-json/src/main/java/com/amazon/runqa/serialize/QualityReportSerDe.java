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

import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

import lombok.Getter;

import com.amazon.runqa.QualityReport;
import com.amazon.runqa.state.report.QualityReportMapper;
import com.amazon.runqa.state.report.QualityReportState;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes the summary of a {@link QualityReport} as JSON. Undefined numbers are
 * left out of the output.
 */
@Getter
public class QualityReportSerDe {

    private final QualityReportMapper mapper;
    private final ObjectMapper objectMapper;

    public QualityReportSerDe() {
        this(new QualityReportMapper(), CauseRuleTableSerDe.defaultObjectMapper());
    }

    public QualityReportSerDe(QualityReportMapper mapper, ObjectMapper objectMapper) {
        this.mapper = checkNotNull(mapper, "mapper must not be null");
        this.objectMapper = checkNotNull(objectMapper, "object mapper must not be null");
    }

    public String toJson(QualityReport report) {
        try {
            return objectMapper.writeValueAsString(mapper.toState(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("unable to write report", e);
        }
    }

    /**
     * writes the report without closing the writer
     */
    public void write(QualityReport report, Writer writer) {
        checkNotNull(writer, "writer must not be null");
        try {
            objectMapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(writer,
                    mapper.toState(report));
        } catch (IOException e) {
            throw new UncheckedIOException("unable to write report", e);
        }
    }

    /**
     * reads back a summary written by {@link #toJson}
     */
    public QualityReportState readState(String json) {
        checkNotNull(json, "json must not be null");
        try {
            return objectMapper.readValue(json, QualityReportState.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("unable to parse report", e);
        }
    }
}
