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
package ru.nts.tools.pbip.graph;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionIssueTest {

    private static final Path SALES = Path.of("tables", "Sales.tmdl");
    private static final Path CUSTOMER = Path.of("tables", "Customer.tmdl");

    @Test
    void testIntroducedIgnoresKnownSites() {
        ResolutionIssue pending = ResolutionIssue.unresolved(SALES, 7, "measure 'Total Sales'", null, "Revenue", "no measure");
        // то же место после переименования меры: описание другое, строка та же
        ResolutionIssue renamed = ResolutionIssue.unresolved(SALES, 7, "measure Revenue", null, "Revenue", "no measure");
        ResolutionIssue created = ResolutionIssue.ambiguous(CUSTOMER, 14, "measure 'Name Count'", null, "Name",
                List.of(IdentifierKey.column("Customer", "Name"), IdentifierKey.measure("Sales", "Name")));
        ResolutionIssue opaque = ResolutionIssue.notAnalyzable(CUSTOMER, 20, "expression", "'Sales", "Unterminated");

        List<ResolutionIssue> introduced = ResolutionIssue.introduced(List.of(pending), List.of(renamed, created, opaque));

        assertEquals(List.of(created), introduced);
        assertTrue(created.isBlocking());
        assertFalse(opaque.isBlocking());
    }

    @Test
    void testIntroducedCountsRepeatedSites() {
        ResolutionIssue first = ResolutionIssue.unresolved(SALES, 3, "measure A", "Missing", "X", "Unknown table");
        ResolutionIssue second = ResolutionIssue.unresolved(SALES, 3, "measure A", "Missing", "Y", "Unknown table");

        assertEquals(List.of(second), ResolutionIssue.introduced(List.of(first), List.of(first, second)));
        assertTrue(ResolutionIssue.introduced(List.of(first, second), List.of(first)).isEmpty());
    }
}
