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

import java.util.ArrayList;

import com.amazon.runqa.verdict.ActionRule;

public class ActionRuleMapper implements IStateMapper<ActionRule, ActionRuleState> {

    @Override
    public ActionRuleState toState(ActionRule model) {
        ActionRuleState state = new ActionRuleState();
        state.setSeverities(Labels.ofSeverities(model.getSeverities()));
        state.setPatterns(Labels.ofPatterns(model.getPatterns()));
        state.setMetricContains(new ArrayList<>(model.getMetricContains()));
        state.setAction(model.getAction());
        return state;
    }

    @Override
    public ActionRule toModel(ActionRuleState state) {
        checkArgument(state.getAction() != null, "an action rule needs an action");
        return new ActionRule(Labels.toSeverities(state.getSeverities()), Labels.toPatterns(state.getPatterns()),
                Labels.orEmpty(state.getMetricContains()), state.getAction());
    }
}
