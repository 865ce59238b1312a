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

import static com.amazon.forestdensity.CommonUtils.checkArgument;
import static com.amazon.forestdensity.CommonUtils.checkData;
import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A column with values drawn from a fixed, ordered list of levels. Missing
 * values are null.
 */
public class CategoricalColumn extends Column {

    private final List<String> levels;
    private final String[] values;

    public CategoricalColumn(String name, List<String> levels, String[] values, Class<?> originalType) {
        super(name, originalType);
        checkNotNull(levels, "levels must not be null");
        checkNotNull(values, "values must not be null");
        checkArgument(!levels.isEmpty(), "a categorical column needs at least one level");
        Set<String> known = new HashSet<>(levels);
        checkArgument(known.size() == levels.size(), "levels must be distinct");
        for (String value : values) {
            checkData(value == null || known.contains(value), "value " + value + " of " + name + " is not a level");
        }
        this.levels = List.copyOf(levels);
        this.values = Arrays.copyOf(values, values.length);
    }

    public CategoricalColumn(String name, List<String> levels, String[] values) {
        this(name, levels, values, String.class);
    }

    @Override
    public ColumnKind getKind() {
        return ColumnKind.CATEGORICAL;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isMissing(int row) {
        return values[row] == null;
    }

    public String getValue(int row) {
        return values[row];
    }

    public List<String> getLevels() {
        return levels;
    }
}
