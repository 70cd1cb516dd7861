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
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Getter;

import com.amazon.runqa.state.CauseRuleTableMapper;
import com.amazon.runqa.state.CauseRuleTableState;
import com.amazon.runqa.verdict.CauseRuleTable;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * {@link CauseRuleTable} serialization. The table is converted to a
 * {@link CauseRuleTableState} by a {@link CauseRuleTableMapper} and the state
 * is written with <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 * The object mapper is exposed so callers can change the output, for example
 * by turning pretty printing off.
 */
@Getter
public class CauseRuleTableSerDe {

    private final CauseRuleTableMapper mapper;
    private final ObjectMapper objectMapper;

    public CauseRuleTableSerDe() {
        this(new CauseRuleTableMapper(), defaultObjectMapper());
    }

    public CauseRuleTableSerDe(CauseRuleTableMapper mapper, ObjectMapper objectMapper) {
        this.mapper = checkNotNull(mapper, "mapper must not be null");
        this.objectMapper = checkNotNull(objectMapper, "object mapper must not be null");
    }

    /**
     * unset condition bounds are left out, unknown properties are an error
     */
    static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String toJson(CauseRuleTable table) {
        try {
            return objectMapper.writeValueAsString(mapper.toState(table));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("unable to write rule table", e);
        }
    }

    public CauseRuleTable fromJson(String json) {
        checkNotNull(json, "json must not be null");
        try {
            return mapper.toModel(objectMapper.readValue(json, CauseRuleTableState.class));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("unable to parse rule table", e);
        }
    }

    public CauseRuleTable fromJson(InputStream in) {
        checkNotNull(in, "input stream must not be null");
        try {
            return mapper.toModel(objectMapper.readValue(in, CauseRuleTableState.class));
        } catch (IOException e) {
            throw new UncheckedIOException("unable to read rule table", e);
        }
    }

    public CauseRuleTable read(Path path) {
        checkNotNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("unable to read rule table from " + path, e);
        }
    }

    public void write(CauseRuleTable table, Path path) {
        checkNotNull(path, "path must not be null");
        try {
            objectMapper.writeValue(path.toFile(), mapper.toState(table));
        } catch (IOException e) {
            throw new UncheckedIOException("unable to write rule table to " + path, e);
        }
    }
}
