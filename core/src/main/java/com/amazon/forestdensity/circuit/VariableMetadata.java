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

import java.util.OptionalInt;

import lombok.Getter;

import com.amazon.forestdensity.config.DistributionFamily;
import com.amazon.forestdensity.data.ColumnKind;

/**
 * What the consumers of a circuit need to know about a variable to turn
 * generated values back into values of the original column.
 */
public class VariableMetadata {

    @Getter
    private final String variable;

    /**
     * the simple name of the type of the original column
     */
    @Getter
    private final String typeClass;

    @Getter
    private final ColumnKind kind;

    @Getter
    private final DistributionFamily family;

    private final int decimals;

    public VariableMetadata(String variable, String typeClass, ColumnKind kind, DistributionFamily family,
            int decimals) {
        this.variable = variable;
        this.typeClass = typeClass;
        this.kind = kind;
        this.family = family;
        this.decimals = decimals;
    }

    /**
     * @return the largest number of decimal digits observed, used to round
     *         generated values; empty for categorical variables
     */
    public OptionalInt getDecimals() {
        return decimals < 0 ? OptionalInt.empty() : OptionalInt.of(decimals);
    }
}
