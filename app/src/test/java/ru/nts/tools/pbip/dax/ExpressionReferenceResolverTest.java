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
package ru.nts.tools.pbip.dax;

import org.junit.jupiter.api.Test;
import ru.nts.tools.pbip.core.SourceSpan;
import ru.nts.tools.pbip.graph.IdentifierKey;
import ru.nts.tools.pbip.graph.IdentifierKind;
import ru.nts.tools.pbip.graph.ModelSymbolTable;
import ru.nts.tools.pbip.graph.ReferenceOccurrence;
import ru.nts.tools.pbip.graph.ResolutionIssue;
import ru.nts.tools.pbip.graph.SyntacticForm;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты поиска ссылок в выражениях DAX.
 */
class ExpressionReferenceResolverTest {

    private static final Path FILE = Path.of("model.tmdl");
    private static final SourceSpan AT = new SourceSpan(0, 0, 1, 1);

    private final ModelSymbolTable symbols = ModelSymbolTable.builder()
            .declare(IdentifierKind.TABLE, null, "Sales", FILE, AT)
            .declare(IdentifierKind.TABLE, null, "Fact Sales", FILE, AT)
            .declare(IdentifierKind.TABLE, null, "Calendar", FILE, AT)
            .declare(IdentifierKind.COLUMN, "Sales", "Amount", FILE, AT)
            .declare(IdentifierKind.COLUMN, "Fact Sales", "Qty", FILE, AT)
            .declare(IdentifierKind.MEASURE, "Sales", "Total Sales", FILE, AT)
            .declare(IdentifierKind.MEASURE, "Fact Sales", "Amount", FILE, AT)
            .build();

    private final ExpressionReferenceResolver resolver = new ExpressionReferenceResolver(symbols);

    private static List<IdentifierKey> targets(ExpressionScan scan) {
        return scan.occurrences().stream().map(ReferenceOccurrence::target).toList();
    }

    // ===== Разрешение =====

    @Test
    void testQualifiedReferences() {
        ExpressionScan scan = resolver.extractReferences("SUM(Sales[Amount]) + SUM('Fact Sales'[Qty])", null);

        assertEquals(List.of(
                IdentifierKey.table("Sales"), IdentifierKey.column("Sales", "Amount"),
                IdentifierKey.table("Fact Sales"), IdentifierKey.column("Fact Sales", "Qty")), targets(scan));
        assertEquals(SyntacticForm.QUOTED_REFERENCE, scan.occurrences().get(2).form());
        assertTrue(scan.issues().isEmpty());
    }

    @Test
    void testWhitespaceBeforeBracket() {
        ExpressionScan scan = resolver.extractReferences(
                "SUM(Sales [Amount]) + SUM('Fact Sales' [Qty]) + SUM(Sales /* net */ [Amount])", "Calendar");

        assertEquals(List.of(
                IdentifierKey.table("Sales"), IdentifierKey.column("Sales", "Amount"),
                IdentifierKey.table("Fact Sales"), IdentifierKey.column("Fact Sales", "Qty"),
                IdentifierKey.table("Sales"), IdentifierKey.column("Sales", "Amount")), targets(scan));
        assertEquals(SyntacticForm.QUALIFIED_REFERENCE, scan.occurrences().get(1).form());
        assertTrue(scan.issues().isEmpty(), scan.issues().toString());
    }

    @Test
    void testKeywordBeforeBracketIsNotTable() {
        ExpressionScan scan = resolver.extractReferences("VAR x = 1 RETURN [Total Sales] * x", null);

        assertEquals(List.of(IdentifierKey.measure("Sales", "Total Sales")), targets(scan));
        assertEquals(SyntacticForm.BARE_REFERENCE, scan.occurrences().get(0).form());
        assertTrue(scan.issues().isEmpty());
    }

    @Test
    void testRewriteKeepsWhitespaceBeforeBracket() {
        String result = resolver.rewrite("SUM(Sales [Amount])", null, Map.of(
                IdentifierKey.table("Sales"), "Fact Orders",
                IdentifierKey.column("Sales", "Amount"), "Net"));

        assertEquals("SUM('Fact Orders' [Net])", result);
    }

    @Test
    void testBareReferencesUseOwningTable() {
        ExpressionScan scan = resolver.extractReferences("DIVIDE([Total Sales], COUNTROWS(sales))", "Sales");

        assertEquals(List.of(IdentifierKey.measure("Sales", "Total Sales"), IdentifierKey.table("Sales")), targets(scan));
        assertEquals("sales", scan.occurrences().get(1).spelled());
    }

    @Test
    void testFunctionsStringsCommentsAndVariablesIgnored() {
        String text = String.join("\n",
                "VAR Sales = CALENDAR(DATE(2024, 1, 1), DATE(2024, 12, 31))",
                "// Sales[Amount]",
                "RETURN COUNTROWS(Sales) & \"Sales[Amount]\"");

        ExpressionScan scan = resolver.extractReferences(text, null);

        assertTrue(scan.occurrences().isEmpty(), scan.occurrences().toString());
        assertTrue(scan.issues().isEmpty());
    }

    @Test
    void testSpansPointIntoFile() {
        String text = "[Total Sales] * 2";
        ExpressionScan scan = resolver.extractReferences(FILE, text, new SourceSpan(40, 40 + text.length(), 3, 17), "Sales");

        SourceSpan span = scan.occurrences().get(0).span();
        assertEquals(40, span.start());
        assertEquals(53, span.end());
        assertEquals(3, span.line());
    }

    // ===== Проблемные места =====

    @Test
    void testAmbiguousBareMember() {
        ExpressionScan scan = resolver.extractReferences("[Amount]", "Sales");

        assertTrue(scan.occurrences().isEmpty());
        ResolutionIssue issue = scan.issues().get(0);
        assertEquals(ResolutionIssue.IssueKind.AMBIGUOUS, issue.kind());
        assertEquals(2, issue.candidates().size());
        assertTrue(issue.candidates().contains(IdentifierKey.column("Sales", "Amount")));
    }

    @Test
    void testUnknownTableAndMember() {
        ExpressionScan scan = resolver.extractReferences("SUM(Missing[X]) + Sales[Nope]", null);

        assertEquals(List.of(IdentifierKey.table("Sales")), targets(scan));
        assertEquals(2, scan.issues().size());
        assertEquals("Missing", scan.issues().get(0).spelledTable());
        assertEquals("Nope", scan.issues().get(1).spelledMember());
        assertTrue(scan.issues().stream().allMatch(i -> i.kind() == ResolutionIssue.IssueKind.UNRESOLVED));
    }

    @Test
    void testUnterminatedIsNotAnalyzable() {
        ExpressionScan scan = resolver.extractReferences("SUM('Sales[Amount])", null);

        assertEquals(ResolutionIssue.IssueKind.NOT_ANALYZABLE, scan.issues().get(0).kind());
    }

    // ===== Перезапись =====

    @Test
    void testRewrite() {
        String result = resolver.rewrite("SUM(Sales[Amount]) + [Total Sales] + COUNTROWS('Sales')", "Sales", Map.of(
                IdentifierKey.table("Sales"), "Fact Orders",
                IdentifierKey.measure("Sales", "Total Sales"), "Net [USD]"));

        assertEquals("SUM('Fact Orders'[Amount]) + [Net [USD]]] + COUNTROWS('Fact Orders')", result);
    }

    @Test
    void testRewriteKeepsBareNameWhenValid() {
        String result = resolver.rewrite("COUNTROWS(Sales) + COUNTROWS('Sales')", null,
                Map.of(IdentifierKey.table("Sales"), "Orders"));

        assertEquals("COUNTROWS(Orders) + COUNTROWS('Orders')", result);
    }
}
