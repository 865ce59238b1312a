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

package com.amazon.forestdensity.coverage;

import java.util.Arrays;

import lombok.Getter;

/**
 * The terminal node of every row in one tree, together with the rows the
 * sampling policy keeps for that tree.
 */
public class LeafAssignment {

    @Getter
    private final int tree;

    private final int[] terminalNodes;
    private final int[] keptRows;

    public LeafAssignment(int tree, int[] terminalNodes, int[] keptRows) {
        this.tree = tree;
        this.terminalNodes = terminalNodes;
        this.keptRows = keptRows;
    }

    /**
     * @param row a row of the estimation dataset
     * @return the leaf the row terminates in
     */
    public int getTerminalNode(int row) {
        return terminalNodes[row];
    }

    /**
     * @return the kept rows in increasing order
     */
    public int[] getKeptRows() {
        return Arrays.copyOf(keptRows, keptRows.length);
    }

    public int getNumberOfKeptRows() {
        return keptRows.length;
    }

    public int getKeptRow(int index) {
        return keptRows[index];
    }
}
