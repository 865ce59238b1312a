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

import static com.amazon.forestdensity.CommonUtils.checkConfiguration;
import static com.amazon.forestdensity.CommonUtils.checkData;
import static com.amazon.forestdensity.CommonUtils.checkNotNull;
import static com.amazon.forestdensity.CommonUtils.decimalPlaces;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.forestdensity.forest.DecisionTree;
import com.amazon.forestdensity.forest.Forest;

/**
 * A dataset translated into the numeric encoding the forest splits on. Every
 * row becomes an array indexed by variable; continuous values are copied,
 * categorical values are replaced by the ordinal ({@code 1..k}) of their label
 * in the level list of the trainer, and missing values of both kinds are NaN.
 *
 * The encoding also records the per-variable facts the estimators need: the
 * column kinds, the global empirical extrema of continuous variables and their
 * decimal precision.
 */
public class EncodedDataset {

    private final double[][] rows;

    @Getter
    private final int numberOfVariables;

    private final String[] names;
    private final ColumnKind[] kinds;
    private final double[] globalMin;
    private final double[] globalMax;
    private final int[] decimals;
    private final List<String>[] levels;

    public EncodedDataset(Dataset dataset, Forest forest) {
        checkNotNull(dataset, "dataset must not be null");
        checkNotNull(forest, "forest must not be null");
        numberOfVariables = dataset.getNumberOfColumns();
        checkConfiguration(numberOfVariables == forest.getNumberOfVariables(), "dataset has " + numberOfVariables
                + " columns but the forest was trained on " + forest.getNumberOfVariables() + " variables");
        for (DecisionTree tree : forest.getTrees()) {
            checkData(tree.getMaxSplitVariable() < numberOfVariables, "split variable out of range");
        }

        int n = dataset.getNumberOfRows();
        rows = new double[n][numberOfVariables];
        names = new String[numberOfVariables];
        kinds = new ColumnKind[numberOfVariables];
        globalMin = new double[numberOfVariables];
        globalMax = new double[numberOfVariables];
        decimals = new int[numberOfVariables];
        levels = new List[numberOfVariables];

        for (int j = 0; j < numberOfVariables; j++) {
            Column column = dataset.getColumn(j);
            names[j] = column.getName();
            kinds[j] = column.getKind();
            globalMin[j] = Double.NaN;
            globalMax[j] = Double.NaN;
            if (column.getKind() == ColumnKind.CONTINUOUS) {
                encodeContinuous(j, (ContinuousColumn) column);
            } else {
                encodeCategorical(j, (CategoricalColumn) column, forest);
            }
        }
    }

    private void encodeContinuous(int j, ContinuousColumn column) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int places = 0;
        for (int i = 0; i < rows.length; i++) {
            double value = column.getValue(i);
            checkData(!Double.isInfinite(value), "column " + column.getName() + " contains infinite values");
            rows[i][j] = value;
            if (!Double.isNaN(value)) {
                min = Math.min(min, value);
                max = Math.max(max, value);
                places = Math.max(places, decimalPlaces(value));
            }
        }
        checkData(min <= max, "column " + column.getName() + " has no observed values");
        globalMin[j] = min;
        globalMax[j] = max;
        decimals[j] = places;
    }

    private void encodeCategorical(int j, CategoricalColumn column, Forest forest) {
        List<String> labels = forest.getLevels(j).orElse(column.getLevels());
        Map<String, Integer> ordinals = new HashMap<>();
        for (int k = 0; k < labels.size(); k++) {
            ordinals.put(labels.get(k), k + 1);
        }
        for (int i = 0; i < rows.length; i++) {
            String value = column.getValue(i);
            if (value == null) {
                rows[i][j] = Double.NaN;
            } else {
                Integer ordinal = ordinals.get(value);
                checkData(ordinal != null, "level " + value + " of " + column.getName() + " is unknown to the forest");
                rows[i][j] = ordinal;
            }
        }
        levels[j] = labels;
        decimals[j] = -1;
    }

    public int getNumberOfRows() {
        return rows.length;
    }

    public double[] getRow(int row) {
        return rows[row];
    }

    public double getValue(int row, int variable) {
        return rows[row][variable];
    }

    public String getName(int variable) {
        return names[variable];
    }

    public ColumnKind getKind(int variable) {
        return kinds[variable];
    }

    public boolean isContinuous(int variable) {
        return kinds[variable] == ColumnKind.CONTINUOUS;
    }

    /**
     * @return the indices of the variables of the given kind, in column order
     */
    public int[] getVariables(ColumnKind kind) {
        int count = 0;
        for (ColumnKind k : kinds) {
            if (k == kind) {
                count++;
            }
        }
        int[] result = new int[count];
        int pos = 0;
        for (int j = 0; j < numberOfVariables; j++) {
            if (kinds[j] == kind) {
                result[pos++] = j;
            }
        }
        return result;
    }

    /**
     * @param variable a continuous variable
     * @return the smallest observed value of the variable
     */
    public double getGlobalMin(int variable) {
        return globalMin[variable];
    }

    /**
     * @param variable a continuous variable
     * @return the largest observed value of the variable
     */
    public double getGlobalMax(int variable) {
        return globalMax[variable];
    }

    /**
     * @param variable a continuous variable
     * @return the largest number of decimal digits among the observed values
     */
    public int getDecimals(int variable) {
        return decimals[variable];
    }

    /**
     * @param variable a categorical variable
     * @return the level labels, the label at position i having ordinal i + 1
     */
    public List<String> getLevels(int variable) {
        return levels[variable];
    }
}
