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

import com.amazon.runqa.verdict.RuleCondition;

public class RuleConditionMapper implements IStateMapper<RuleCondition, RuleConditionState> {

    @Override
    public RuleConditionState toState(RuleCondition model) {
        RuleConditionState state = new RuleConditionState();
        model.getValueAbove().ifPresent(state::setValueAbove);
        model.getValueBelow().ifPresent(state::setValueBelow);
        model.getValueAtMost().ifPresent(state::setValueAtMost);
        model.getZAbove().ifPresent(state::setLocalZAbove);
        model.getZAtMost().ifPresent(state::setLocalZAtMost);
        model.getDeadAbove().ifPresent(state::setDeadAbove);
        model.getDeadAtMost().ifPresent(state::setDeadAtMost);
        model.getHotAbove().ifPresent(state::setHotAbove);
        model.getHotAtMost().ifPresent(state::setHotAtMost);
        return state;
    }

    @Override
    public RuleCondition toModel(RuleConditionState state) {
        if (state == null) {
            return RuleCondition.ALWAYS;
        }
        RuleCondition.Builder builder = RuleCondition.builder();
        if (state.getValueAbove() != null) {
            builder.valueAbove(state.getValueAbove());
        }
        if (state.getValueBelow() != null) {
            builder.valueBelow(state.getValueBelow());
        }
        if (state.getValueAtMost() != null) {
            builder.valueAtMost(state.getValueAtMost());
        }
        if (state.getLocalZAbove() != null) {
            builder.zAbove(state.getLocalZAbove());
        }
        if (state.getLocalZAtMost() != null) {
            builder.zAtMost(state.getLocalZAtMost());
        }
        if (state.getDeadAbove() != null) {
            builder.deadAbove(state.getDeadAbove());
        }
        if (state.getDeadAtMost() != null) {
            builder.deadAtMost(state.getDeadAtMost());
        }
        if (state.getHotAbove() != null) {
            builder.hotAbove(state.getHotAbove());
        }
        if (state.getHotAtMost() != null) {
            builder.hotAtMost(state.getHotAtMost());
        }
        return builder.build();
    }
}
