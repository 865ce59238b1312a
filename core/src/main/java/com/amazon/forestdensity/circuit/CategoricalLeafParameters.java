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

package com.amazon.forestdensity.circuit;

import lombok.Getter;

/**
 * The probability of one level of a categorical variable within a leaf.
 */
@Getter
public class CategoricalLeafParameters {

    private final int fIdx;
    private final String variable;
    private final String level;
    private final double prob;
    private final double naShare;

    public CategoricalLeafParameters(int fIdx, String variable, String level, double prob, double naShare) {
        this.fIdx = fIdx;
        this.variable = variable;
        this.level = level;
        this.prob = prob;
        this.naShare = naShare;
    }
}
