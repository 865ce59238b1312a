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
import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.Getter;

/**
 * The rows used to estimate the circuit, stored by column. Column i holds the
 * values of the variable that the forest refers to as split variable i.
 */
public class Dataset {

    private final List<Column> columns;

    @Getter
    private final int numberOfRows;

    /**
     * A tag naming the kind of input the rows came from, handed back to the
     * consumers of the circuit.
     */
    @Getter
    private final String inputType;

    protected Dataset(Builder<?> builder) {
        checkArgument(!builder.columns.isEmpty(), "a dataset needs at least one column");
        int rows = builder.columns.get(0).size();
        Set<String> names = new HashSet<>();
        for (Column column : builder.columns) {
            checkArgument(column.size() == rows, "all columns must have the same number of rows");
            checkArgument(names.add(column.getName()), "duplicate column " + column.getName());
        }
        checkArgument(rows > 0, "a dataset needs at least one row");
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.numberOfRows = rows;
        this.inputType = builder.inputType;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public List<Column> getColumns() {
        return columns;
    }

    public Column getColumn(int index) {
        return columns.get(index);
    }

    public int getNumberOfColumns() {
        return columns.size();
    }

    public static class Builder<T extends Builder<T>> {

        private final List<Column> columns = new ArrayList<>();
        private String inputType = Dataset.class.getSimpleName();

        public T addColumn(Column column) {
            checkNotNull(column, "column must not be null");
            columns.add(column);
            return (T) this;
        }

        public T addContinuous(String name, double[] values) {
            return addColumn(new ContinuousColumn(name, values));
        }

        public T addCategorical(String name, List<String> levels, String[] values) {
            return addColumn(new CategoricalColumn(name, levels, values));
        }

        public T inputType(String inputType) {
            this.inputType = checkNotNull(inputType, "inputType must not be null");
            return (T) this;
        }

        public Dataset build() {
            return new Dataset(this);
        }
    }
}
