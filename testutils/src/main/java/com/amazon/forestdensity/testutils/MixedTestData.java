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

package com.amazon.forestdensity.testutils;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * This class samples rows with continuous and categorical columns. The first
 * columns are continuous and drawn from a mixture of two normal distributions;
 * the remaining columns are categorical with levels {@code L1..Lk}, encoded by
 * their ordinal, and loosely correlated with the first continuous column.
 * Missing values are NaN.
 */
public class MixedTestData {

    private final int numberOfContinuous;
    private final int numberOfCategorical;
    private final int numberOfLevels;
    private final double missingFraction;
    private final int decimals;

    public MixedTestData(int numberOfContinuous, int numberOfCategorical, int numberOfLevels,
            double missingFraction, int decimals) {
        this.numberOfContinuous = numberOfContinuous;
        this.numberOfCategorical = numberOfCategorical;
        this.numberOfLevels = numberOfLevels;
        this.missingFraction = missingFraction;
        this.decimals = decimals;
    }

    public MixedTestData() {
        this(3, 2, 4, 0.05, 2);
    }

    public int getNumberOfColumns() {
        return numberOfContinuous + numberOfCategorical;
    }

    public int getNumberOfContinuous() {
        return numberOfContinuous;
    }

    public int getNumberOfLevels() {
        return numberOfLevels;
    }

    public boolean isCategorical(int column) {
        return column >= numberOfContinuous;
    }

    public boolean[] getCategoricalColumns() {
        boolean[] result = new boolean[getNumberOfColumns()];
        for (int j = 0; j < result.length; j++) {
            result[j] = isCategorical(j);
        }
        return result;
    }

    public static String label(int ordinal) {
        return "L" + ordinal;
    }

    public List<String> getLevels() {
        List<String> levels = new ArrayList<>();
        for (int k = 1; k <= numberOfLevels; k++) {
            levels.add(label(k));
        }
        return levels;
    }

    public double[][] generateTestData(int numberOfRows, long seed) {
        Random random = new Random(seed);
        double scale = Math.pow(10, decimals);
        double[][] rows = new double[numberOfRows][getNumberOfColumns()];
        for (int i = 0; i < numberOfRows; i++) {
            boolean second = random.nextDouble() < 0.3;
            for (int j = 0; j < numberOfContinuous; j++) {
                double value = second ? 4.0 + 2.0 * random.nextGaussian() : random.nextGaussian();
                rows[i][j] = Math.round(value * scale) / scale;
            }
            for (int j = numberOfContinuous; j < rows[i].length; j++) {
                int ordinal = second ? 1 + random.nextInt(Math.max(1, numberOfLevels / 2))
                        : 1 + random.nextInt(numberOfLevels);
                rows[i][j] = ordinal;
            }
            for (int j = 0; j < rows[i].length; j++) {
                if (random.nextDouble() < missingFraction) {
                    rows[i][j] = Double.NaN;
                }
            }
        }
        return rows;
    }

    /**
     * @param rows   rows produced by {@link #generateTestData}
     * @param column a continuous column
     * @return the values of the column
     */
    public static double[] continuousColumn(double[][] rows, int column) {
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = rows[i][column];
        }
        return values;
    }

    /**
     * @param rows   rows produced by {@link #generateTestData}
     * @param column a categorical column
     * @return the labels of the column, null where missing
     */
    public static String[] categoricalColumn(double[][] rows, int column) {
        String[] values = new String[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = Double.isNaN(rows[i][column]) ? null : label((int) rows[i][column]);
        }
        return values;
    }
}
