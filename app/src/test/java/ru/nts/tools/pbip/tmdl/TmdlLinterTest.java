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
package ru.nts.tools.pbip.tmdl;

import org.junit.jupiter.api.Test;
import ru.nts.tools.pbip.TestProjects;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TmdlLinterTest {

    private final TmdlParser parser = new TmdlParser();
    private final TmdlLinter linter = new TmdlLinter();

    @Test
    void testCleanModelHasNoDiagnostics() throws Exception {
        TmdlDocument doc = parser.parse(Path.of("Sales.tmdl"), TestProjects.SALES_TMDL);
        assertTrue(linter.lint(doc, List.of("Sales", "Customer")).isEmpty());
    }

    @Test
    void testUnquotedNamesAndReferences() throws Exception {
        String text = String.join("\n",
                "table Leads Sales Data",
                "",
                "\tcolumn Customer Name",
                "\t\tsortByColumn: Customer Key",
                "",
                "\tmeasure Total = SUM(Leads Sales Data[Amount]) + COUNTROWS('Leads Sales Data')",
                "");
        TmdlDocument doc = parser.parse(Path.of("Leads.tmdl"), text);

        List<TmdlDiagnostic> diagnostics = linter.lint(doc, List.of("Leads Sales Data"));

        assertEquals(2, diagnostics.stream().filter(d -> d.type() == TmdlDiagnostic.Type.UNQUOTED_NAME).count());
        assertEquals(1, diagnostics.stream().filter(d -> d.type() == TmdlDiagnostic.Type.UNQUOTED_REFERENCE).count());
        TmdlDiagnostic dax = diagnostics.stream()
                .filter(d -> d.type() == TmdlDiagnostic.Type.UNQUOTED_TABLE_IN_DAX)
                .findFirst().orElseThrow();
        assertEquals(6, dax.line());
        assertTrue(dax.message().contains("measure Total"));
        assertTrue(dax.context().startsWith("measure Total ="));
    }

    @Test
    void testNames() {
        assertFalse(TmdlNames.needsQuoting("Sales"));
        assertFalse(TmdlNames.needsQuoting("Продажи"));
        assertTrue(TmdlNames.needsQuoting("Fact Sales"));
        assertTrue(TmdlNames.needsQuoting("table"));
        assertTrue(TmdlNames.needsQuoting("2024"));
        assertEquals("'Bob''s'", TmdlNames.format("Bob's", false));
        assertEquals("'Sales'", TmdlNames.format("Sales", true));
        assertEquals("Bob's", TmdlNames.unquote(" 'Bob''s' "));
        assertEquals("Sales", TmdlNames.unquote("Sales"));
    }
}
