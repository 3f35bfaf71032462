package io.nosqlbench.estimators.api;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.estimators.errors.NotFittedException;
import io.nosqlbench.estimators.errors.ShapeMismatchException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class LearnedStateTest {

    @Test
    void testUnfittedState() {
        LearnedState<String> state = new LearnedState<>("test_model");

        assertFalse(state.isFitted());
        assertNull(state.current());
        NotFittedException e = assertThrows(NotFittedException.class, () -> state.require("transform"));
        assertEquals("transform", e.getOperation());
        assertEquals("test_model", e.getModelType());
        assertThrows(NotFittedException.class, state::columns);
    }

    @Test
    void testCommitAccumulatesSamples() {
        LearnedState<String> state = new LearnedState<>("test_model");
        state.commit("first", 4, 10);
        state.commit("second", 4, 5);

        assertTrue(state.isFitted());
        assertEquals("second", state.require("predict"));
        assertEquals(4, state.columns());
        assertEquals(15, state.samplesSeen());
    }

    @Test
    void testRejectedCommitKeepsPreviousParameters() {
        LearnedState<String> state = new LearnedState<>("test_model");
        state.commit("first", 4, 10);

        ShapeMismatchException e = assertThrows(ShapeMismatchException.class, () -> state.commit("second", 3, 5));
        assertEquals(4, e.getExpected());
        assertEquals(3, e.getActual());
        assertEquals("first", state.current());
        assertEquals(10, state.samplesSeen());
    }

    @Test
    void testResetForgetsColumns() {
        LearnedState<String> state = new LearnedState<>("test_model");
        state.commit("first", 4, 10);
        state.reset();

        assertFalse(state.isFitted());
        assertEquals(0, state.samplesSeen());
        assertDoesNotThrow(() -> state.checkColumns(7));
        state.commit("second", 7, 1);
        assertEquals(7, state.columns());
    }
}
