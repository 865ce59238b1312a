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

package com.amazon.forestdensity.state;

import java.io.Serializable;

import lombok.Data;

/**
 * The categorical parameter table of a circuit, stored by column.
 */
@Data
public class CategoricalParametersState implements Serializable {
    private static final long serialVersionUID = 1L;

    private int[] fIdx;
    private String[] variable;
    private String[] level;
    private double[] prob;
    private double[] naShare;
}
