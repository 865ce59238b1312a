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

import static com.amazon.forestdensity.CommonUtils.checkArgument;
import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.forestdensity.circuit.CategoricalLeafParameters;
import com.amazon.forestdensity.circuit.CircuitLeaf;
import com.amazon.forestdensity.circuit.ContinuousLeafParameters;
import com.amazon.forestdensity.circuit.ProbabilisticCircuit;
import com.amazon.forestdensity.circuit.VariableMetadata;
import com.amazon.forestdensity.config.DistributionFamily;
import com.amazon.forestdensity.data.ColumnKind;

/**
 * Maps a circuit to its column-oriented state and back.
 */
public class ProbabilisticCircuitMapper implements IStateMapper<ProbabilisticCircuit, ProbabilisticCircuitState> {

    public static final String VERSION = "1.0";

    @Override
    public ProbabilisticCircuitState toState(ProbabilisticCircuit model) {
        checkNotNull(model, "circuit must not be null");
        ProbabilisticCircuitState state = new ProbabilisticCircuitState();
        state.setVersion(VERSION);
        state.setContinuousState(toContinuousState(model.getContinuousParameters()));
        state.setCategoricalState(toCategoricalState(model.getCategoricalParameters()));
        state.setLeavesState(toLeavesState(model.getLeaves()));
        state.setMetadataState(toMetadataState(model.getMetadata()));
        Map<String, String[]> levels = new LinkedHashMap<>();
        model.getLevels().forEach((name, labels) -> levels.put(name, labels.toArray(new String[0])));
        state.setLevels(levels);
        state.setInputType(model.getInputType());
        return state;
    }

    @Override
    public ProbabilisticCircuit toModel(ProbabilisticCircuitState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(VERSION.equals(state.getVersion()), "unsupported state version " + state.getVersion());

        ContinuousParametersState cnt = state.getContinuousState();
        List<ContinuousLeafParameters> continuous = new ArrayList<>();
        for (int i = 0; i < cnt.getFIdx().length; i++) {
            continuous.add(new ContinuousLeafParameters(cnt.getFIdx()[i], cnt.getVariable()[i], cnt.getMin()[i],
                    cnt.getMax()[i], cnt.getMu()[i], cnt.getSigma()[i], cnt.getNaShare()[i]));
        }

        CategoricalParametersState cat = state.getCategoricalState();
        List<CategoricalLeafParameters> categorical = new ArrayList<>();
        for (int i = 0; i < cat.getFIdx().length; i++) {
            categorical.add(new CategoricalLeafParameters(cat.getFIdx()[i], cat.getVariable()[i], cat.getLevel()[i],
                    cat.getProb()[i], cat.getNaShare()[i]));
        }

        CircuitLeavesState leavesState = state.getLeavesState();
        List<CircuitLeaf> leaves = new ArrayList<>();
        for (int i = 0; i < leavesState.getFIdx().length; i++) {
            leaves.add(new CircuitLeaf(leavesState.getFIdx()[i], leavesState.getTree()[i], leavesState.getLeaf()[i],
                    leavesState.getCoverage()[i]));
        }

        VariableMetadataState meta = state.getMetadataState();
        List<VariableMetadata> metadata = new ArrayList<>();
        for (int i = 0; i < meta.getVariable().length; i++) {
            metadata.add(new VariableMetadata(meta.getVariable()[i], meta.getTypeClass()[i],
                    ColumnKind.valueOf(meta.getKind()[i]), DistributionFamily.valueOf(meta.getFamily()[i]),
                    meta.getDecimals()[i]));
        }

        Map<String, List<String>> levels = new LinkedHashMap<>();
        state.getLevels().forEach((name, labels) -> levels.put(name, Arrays.asList(labels)));
        return new ProbabilisticCircuit(continuous, categorical, leaves, metadata, levels, state.getInputType());
    }

    ContinuousParametersState toContinuousState(List<ContinuousLeafParameters> rows) {
        int n = rows.size();
        ContinuousParametersState state = new ContinuousParametersState();
        state.setFIdx(new int[n]);
        state.setVariable(new String[n]);
        state.setMin(new double[n]);
        state.setMax(new double[n]);
        state.setMu(new double[n]);
        state.setSigma(new double[n]);
        state.setNaShare(new double[n]);
        for (int i = 0; i < n; i++) {
            ContinuousLeafParameters row = rows.get(i);
            state.getFIdx()[i] = row.getFIdx();
            state.getVariable()[i] = row.getVariable();
            state.getMin()[i] = row.getMin();
            state.getMax()[i] = row.getMax();
            state.getMu()[i] = row.getMu();
            state.getSigma()[i] = row.getSigma();
            state.getNaShare()[i] = row.getNaShare();
        }
        return state;
    }

    CategoricalParametersState toCategoricalState(List<CategoricalLeafParameters> rows) {
        int n = rows.size();
        CategoricalParametersState state = new CategoricalParametersState();
        state.setFIdx(new int[n]);
        state.setVariable(new String[n]);
        state.setLevel(new String[n]);
        state.setProb(new double[n]);
        state.setNaShare(new double[n]);
        for (int i = 0; i < n; i++) {
            CategoricalLeafParameters row = rows.get(i);
            state.getFIdx()[i] = row.getFIdx();
            state.getVariable()[i] = row.getVariable();
            state.getLevel()[i] = row.getLevel();
            state.getProb()[i] = row.getProb();
            state.getNaShare()[i] = row.getNaShare();
        }
        return state;
    }

    CircuitLeavesState toLeavesState(List<CircuitLeaf> leaves) {
        int n = leaves.size();
        CircuitLeavesState state = new CircuitLeavesState();
        state.setFIdx(new int[n]);
        state.setTree(new int[n]);
        state.setLeaf(new int[n]);
        state.setCoverage(new double[n]);
        for (int i = 0; i < n; i++) {
            CircuitLeaf leaf = leaves.get(i);
            state.getFIdx()[i] = leaf.getFIdx();
            state.getTree()[i] = leaf.getTree();
            state.getLeaf()[i] = leaf.getLeaf();
            state.getCoverage()[i] = leaf.getCoverage();
        }
        return state;
    }

    VariableMetadataState toMetadataState(List<VariableMetadata> metadata) {
        int n = metadata.size();
        VariableMetadataState state = new VariableMetadataState();
        state.setVariable(new String[n]);
        state.setTypeClass(new String[n]);
        state.setKind(new String[n]);
        state.setFamily(new String[n]);
        state.setDecimals(new int[n]);
        for (int i = 0; i < n; i++) {
            VariableMetadata entry = metadata.get(i);
            state.getVariable()[i] = entry.getVariable();
            state.getTypeClass()[i] = entry.getTypeClass();
            state.getKind()[i] = entry.getKind().name();
            state.getFamily()[i] = entry.getFamily().name();
            state.getDecimals()[i] = entry.getDecimals().orElse(-1);
        }
        return state;
    }
}
