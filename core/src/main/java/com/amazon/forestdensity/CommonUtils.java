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

package com.amazon.forestdensity;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A collection of common utility functions.
 */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link ConfigurationException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the exception.
     * @throws ConfigurationException if {@code condition} is false.
     */
    public static void checkConfiguration(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    /**
     * Throws a {@link DataException} with the specified message if the specified
     * input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the exception.
     * @throws DataException if {@code condition} is false.
     */
    public static void checkData(boolean condition, String message) {
        if (!condition) {
            throw new DataException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * The number of digits after the decimal point in the shortest decimal
     * representation of a double; 0 for integral values.
     *
     * @param value a finite value
     * @return the number of decimal digits
     */
    public static int decimalPlaces(double value) {
        checkArgument(Double.isFinite(value), "value must be finite");
        return Math.max(0, BigDecimal.valueOf(value).stripTrailingZeros().scale());
    }

    /**
     * Replaces an infinite value by a fallback.
     *
     * @param value    the value
     * @param fallback the value used if {@code value} is infinite
     * @return value if it is finite, fallback otherwise
     */
    public static double finiteOr(double value, double fallback) {
        return Double.isInfinite(value) ? fallback : value;
    }
}
