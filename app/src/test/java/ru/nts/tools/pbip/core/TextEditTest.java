/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.pbip.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты применения правок по смещениям.
 */
class TextEditTest {

    @Test
    void testApplyAll_RightToLeftKeepsOffsets() {
        String source = "SUM(Sales[Amount]) + COUNTROWS(Sales)";
        String result = TextEdit.applyAll(source, List.of(
                new TextEdit(4, 9, "'Fact Sales'"),
                new TextEdit(31, 36, "'Fact Sales'")));

        assertEquals("SUM('Fact Sales'[Amount]) + COUNTROWS('Fact Sales')", result);
    }

    @Test
    void testApplyAll_OrderOfEditsDoesNotMatter() {
        String source = "abc def";
        List<TextEdit> forward = List.of(new TextEdit(0, 3, "x"), new TextEdit(4, 7, "yy"));
        List<TextEdit> backward = List.of(new TextEdit(4, 7, "yy"), new TextEdit(0, 3, "x"));

        assertEquals("x yy", TextEdit.applyAll(source, forward));
        assertEquals("x yy", TextEdit.applyAll(source, backward));
    }

    @Test
    void testApplyAll_NoEditsReturnsSameInstance() {
        String source = "table Sales";
        assertSame(source, TextEdit.applyAll(source, List.of()));
    }

    @Test
    void testApplyAll_IdenticalDuplicatesAppliedOnce() {
        String result = TextEdit.applyAll("Sales", List.of(new TextEdit(0, 5, "Orders"), new TextEdit(0, 5, "Orders")));
        assertEquals("Orders", result);
    }

    @Test
    void testApplyAll_OverlapRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                TextEdit.applyAll("abcdef", List.of(new TextEdit(0, 4, "x"), new TextEdit(2, 5, "y"))));
        assertTrue(e.getMessage().contains("Overlapping"));
    }

    @Test
    void testApplyAll_BeyondEndRejected() {
        assertThrows(IllegalArgumentException.class, () -> TextEdit.applyAll("abc", List.of(new TextEdit(2, 10, "x"))));
    }

    @Test
    void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new TextEdit(5, 2, ""));
        assertThrows(IllegalArgumentException.class, () -> new SourceSpan(-1, 2, 1, 1));
    }

    @Test
    void testReplaceBySpan() {
        SourceSpan span = new SourceSpan(6, 11, 1, 7);
        assertEquals("Sales", span.slice("table Sales"));
        assertEquals("table Orders", TextEdit.applyAll("table Sales", List.of(TextEdit.replace(span, "Orders"))));
    }
}
