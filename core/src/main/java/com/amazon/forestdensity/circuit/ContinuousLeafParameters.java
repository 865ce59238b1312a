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
 * The distribution of a continuous variable within a leaf. For the truncated
 * normal family {@code mu} and {@code sigma} are the parameters of the normal
 * distribution restricted to {@code [min, max]}; for the uniform family both are
 * NaN and the interval is the whole parameterization.
 */
@Getter
public class ContinuousLeafParameters {

    private final int fIdx;
    private final String variable;
    private final double min;
    private final double max;
    private final double mu;
    private final double sigma;

    /**
     * the fraction of the rows of the leaf with a missing value
     */
    private final double naShare;

    public ContinuousLeafParameters(int fIdx, String variable, double min, double max, double mu, double sigma,
            double naShare) {
        this.fIdx = fIdx;
        this.variable = variable;
        this.min = min;
        this.max = max;
        this.mu = mu;
        this.sigma = sigma;
        this.naShare = naShare;
    }
}
