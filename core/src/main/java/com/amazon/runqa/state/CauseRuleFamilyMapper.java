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
import java.util.stream.Collectors;

import com.amazon.runqa.verdict.CauseRuleFamily;

public class CauseRuleFamilyMapper implements IStateMapper<CauseRuleFamily, CauseRuleFamilyState> {

    private final CauseRuleMapper ruleMapper = new CauseRuleMapper();

    @Override
    public CauseRuleFamilyState toState(CauseRuleFamily model) {
        CauseRuleFamilyState state = new CauseRuleFamilyState();
        state.setName(model.getName());
        state.setAnyOf(new ArrayList<>(model.getAnyOf()));
        state.setAllOf(new ArrayList<>(model.getAllOf()));
        state.setRules(model.getRules().stream().map(ruleMapper::toState).collect(Collectors.toList()));
        return state;
    }

    @Override
    public CauseRuleFamily toModel(CauseRuleFamilyState state) {
        checkArgument(state.getName() != null, "a rule family needs a name");
        checkArgument(state.getRules() != null, "rule family " + state.getName() + " has no rules");
        return new CauseRuleFamily(state.getName(), Labels.orEmpty(state.getAnyOf()), Labels.orEmpty(state.getAllOf()),
                state.getRules().stream().map(ruleMapper::toModel).collect(Collectors.toList()));
    }
}
