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

package com.amazon.forestdensity.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.forestdensity.ConfigurationException;

public class SamplingPolicyTest {

    @ParameterizedTest
    @EnumSource(SamplingPolicy.class)
    public void testFromName(SamplingPolicy policy) {
        assertEquals(policy, SamplingPolicy.fromName(policy.getExternalName()));
        assertEquals(policy, SamplingPolicy.fromName(policy.name()));
        assertEquals(policy, SamplingPolicy.fromName(policy.getExternalName().toUpperCase()));
    }

    @Test
    public void testUnknownName() {
        assertThrows(ConfigurationException.class, () -> SamplingPolicy.fromName("bootstrap"));
        assertThrows(NullPointerException.class, () -> SamplingPolicy.fromName(null));
    }

    @Test
    public void testKeeps() {
        assertTrue(SamplingPolicy.ALL.keeps(0));
        assertTrue(SamplingPolicy.ALL.keeps(3));
        assertTrue(SamplingPolicy.OUT_OF_BAG.keeps(0));
        assertFalse(SamplingPolicy.OUT_OF_BAG.keeps(1));
        assertFalse(SamplingPolicy.IN_BAG.keeps(0));
        assertTrue(SamplingPolicy.IN_BAG.keeps(2));

        assertFalse(SamplingPolicy.ALL.usesInBagCounts());
        assertTrue(SamplingPolicy.OUT_OF_BAG.usesInBagCounts());
        assertTrue(SamplingPolicy.IN_BAG.usesInBagCounts());
    }
}
