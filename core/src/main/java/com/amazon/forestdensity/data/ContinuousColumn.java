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

package com.amazon.forestdensity.data;

import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * A numeric column. Missing values are NaN.
 */
public class ContinuousColumn extends Column {

    private final double[] values;

    public ContinuousColumn(String name, double[] values, Class<?> originalType) {
        super(name, originalType);
        checkNotNull(values, "values must not be null");
        this.values = Arrays.copyOf(values, values.length);
    }

    public ContinuousColumn(String name, double[] values) {
        this(name, values, Double.class);
    }

    @Override
    public ColumnKind getKind() {
        return ColumnKind.CONTINUOUS;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isMissing(int row) {
        return Double.isNaN(values[row]);
    }

    public double getValue(int row) {
        return values[row];
    }
}
