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

package com.amazon.anomalyscore.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class DetectionMethodTest {

    @ParameterizedTest
    @CsvSource({ "statistical,STATISTICAL", "adtk-style,ADTK_STYLE", "adtk,ADTK_STYLE", "ml,ML", "ML,ML",
            "' Statistical ',STATISTICAL" })
    public void testFromName(String name, DetectionMethod expected) {
        assertEquals(expected, DetectionMethod.fromName(name));
    }

    @Test
    public void testFromNameUnknown() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DetectionMethod.fromName("isolation-forest"));
        assertTrue(e.getMessage().contains("statistical, adtk-style, ml"));
        assertThrows(IllegalArgumentException.class, () -> DetectionMethod.fromName(null));
    }

    @Test
    public void testFallbackOrder() {
        assertEquals(Optional.of(DetectionMethod.ADTK_STYLE), DetectionMethod.ML.getFallback());
        assertEquals(Optional.of(DetectionMethod.STATISTICAL), DetectionMethod.ADTK_STYLE.getFallback());
        assertEquals(Optional.empty(), DetectionMethod.STATISTICAL.getFallback());
        assertTrue(DetectionMethod.STATISTICAL.isTerminal());
        assertFalse(DetectionMethod.ML.isTerminal());
        assertEquals("adtk-style", DetectionMethod.ADTK_STYLE.toString());
    }
}
