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
import java.util.Map;

import lombok.Data;

/**
 * A plain representation of a {@link com.amazon.forestdensity.circuit.ProbabilisticCircuit}
 * for serialization.
 */
@Data
public class ProbabilisticCircuitState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version;
    private ContinuousParametersState continuousState;
    private CategoricalParametersState categoricalState;
    private CircuitLeavesState leavesState;
    private VariableMetadataState metadataState;
    private Map<String, String[]> levels;
    private String inputType;
}
