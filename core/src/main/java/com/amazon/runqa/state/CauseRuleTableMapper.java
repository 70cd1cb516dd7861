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

package com.amazon.runqa.state;

import static com.amazon.runqa.CommonUtils.checkArgument;
import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.stream.Collectors;

import com.amazon.runqa.verdict.CauseRuleTable;

/**
 * Creates a {@link CauseRuleTableState} from a {@link CauseRuleTable} and vice
 * versa. Missing lists in a state are read as empty and a missing default
 * action as {@link CauseRuleTable#DEFAULT_ACTION}, so hand-written tables may
 * leave them out.
 */
public class CauseRuleTableMapper implements IStateMapper<CauseRuleTable, CauseRuleTableState> {

    public static final String VERSION = "1.0";

    private final CauseRuleFamilyMapper familyMapper = new CauseRuleFamilyMapper();

    private final ActionRuleMapper actionMapper = new ActionRuleMapper();

    @Override
    public CauseRuleTableState toState(CauseRuleTable model) {
        checkNotNull(model, "rule table must not be null");
        CauseRuleTableState state = new CauseRuleTableState();
        state.setVersion(VERSION);
        state.setFamilies(model.getFamilies().stream().map(familyMapper::toState).collect(Collectors.toList()));
        state.setActionRules(model.getActionRules().stream().map(actionMapper::toState).collect(Collectors.toList()));
        state.setDefaultAction(model.getDefaultAction());
        return state;
    }

    @Override
    public CauseRuleTable toModel(CauseRuleTableState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(state.getVersion() == null || VERSION.equals(state.getVersion()),
                "unsupported rule table version " + state.getVersion());
        return new CauseRuleTable(
                state.getFamilies() == null ? Collections.emptyList()
                        : state.getFamilies().stream().map(familyMapper::toModel).collect(Collectors.toList()),
                state.getActionRules() == null ? Collections.emptyList()
                        : state.getActionRules().stream().map(actionMapper::toModel).collect(Collectors.toList()),
                state.getDefaultAction() == null ? CauseRuleTable.DEFAULT_ACTION : state.getDefaultAction());
    }
}
