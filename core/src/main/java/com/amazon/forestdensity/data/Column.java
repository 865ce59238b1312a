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

import lombok.Getter;

/**
 * A named column of a {@link Dataset}.
 */
@Getter
public abstract class Column {

    private final String name;

    /**
     * The type of the values in the source the column was loaded from, reported
     * in the variable metadata of the circuit.
     */
    private final Class<?> originalType;

    protected Column(String name, Class<?> originalType) {
        this.name = checkNotNull(name, "name must not be null");
        this.originalType = checkNotNull(originalType, "originalType must not be null");
    }

    public abstract ColumnKind getKind();

    public abstract int size();

    public abstract boolean isMissing(int row);
}
