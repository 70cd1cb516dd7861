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

import java.util.ArrayList;

import com.amazon.runqa.verdict.CauseRule;

public class CauseRuleMapper implements IStateMapper<CauseRule, CauseRuleState> {

    private final RuleConditionMapper conditionMapper = new RuleConditionMapper();

    @Override
    public CauseRuleState toState(CauseRule model) {
        CauseRuleState state = new CauseRuleState();
        state.setPatterns(Labels.ofPatterns(model.getPatterns()));
        if (!model.getCondition().isAlways()) {
            state.setCondition(conditionMapper.toState(model.getCondition()));
        }
        state.setCauses(new ArrayList<>(model.getCauses()));
        state.setContinueMatching(model.isContinueMatching());
        return state;
    }

    @Override
    public CauseRule toModel(CauseRuleState state) {
        return new CauseRule(Labels.toPatterns(state.getPatterns()), conditionMapper.toModel(state.getCondition()),
                Labels.orEmpty(state.getCauses()), state.isContinueMatching());
    }
}
