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
import ru.nts.tools.pbip.core.ModelParseException;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты разбора TMDL: структура, выражения, ссылки в свойствах и ошибки.
 */
class TmdlParserTest {

    private final TmdlParser parser = new TmdlParser();
    private final Path file = Path.of("Sales.tmdl");

    // ===== Структура =====

    @Test
    void testParseTable() throws Exception {
        TmdlDocument doc = parser.parse(file, TestProjects.SALES_TMDL);

        assertEquals(1, doc.roots().size());
        TmdlNode table = doc.roots().get(0);
        assertEquals(TmdlNodeKind.TABLE, table.kind());
        assertEquals("Sales", table.name());
        assertEquals("6d1c0a52-0001", table.propertyValue("lineageTag"));

        List<TmdlNode> children = table.children();
        assertEquals(5, children.size());
        TmdlNode totalSales = children.get(0);
        assertEquals(TmdlNodeKind.MEASURE, totalSales.kind());
        assertEquals("Total Sales", totalSales.name());
        assertTrue(totalSales.nameToken().quoted());
        assertEquals("SUM(Sales[Amount])", totalSales.expression().text());
        assertEquals("#,0.00", totalSales.propertyValue("formatString"));

        TmdlNode partition = children.get(4);
        assertEquals(TmdlNodeKind.PARTITION, partition.kind());
        assertEquals("m", partition.expression().text());
        String source = partition.property("source").orElseThrow().expression().text();
        assertTrue(source.startsWith("let"));
        assertTrue(source.endsWith("Source"));
    }

    /**
     * Без правок документ записывается байт в байт.
     */
    @Test
    void testWriteWithoutEditsIsIdentity() throws Exception {
        for (String text : List.of(TestProjects.MODEL_TMDL, TestProjects.SALES_TMDL, TestProjects.CUSTOMER_TMDL,
                TestProjects.RELATIONSHIPS_TMDL, TestProjects.SALES_TMDL.replace("\n", "\r\n"))) {
            TmdlDocument doc = parser.parse(file, text);
            assertEquals(text, doc.write());
            assertEquals(text, doc.write(List.of()));
        }
    }

    @Test
    void testCrLfNames() throws Exception {
        TmdlDocument doc = parser.parse(file, "table Sales\r\n\tcolumn Amount\r\n\t\tdataType: decimal\r\n");

        TmdlNode column = doc.roots().get(0).children().get(0);
        assertEquals("Amount", column.name());
        assertEquals("decimal", column.propertyValue("dataType"));
    }

    @Test
    void testMultiLineExpression() throws Exception {
        String text = String.join("\n",
                "table T",
                "\tmeasure 'M' =",
                "\t\t\tVAR x = 1",
                "\t\t\tRETURN",
                "\t\t\t\tx + 1",
                "\t\tformatString: 0",
                "");
        TmdlNode measure = parser.parse(file, text).roots().get(0).children().get(0);

        assertEquals("VAR x = 1\n\t\t\tRETURN\n\t\t\t\tx + 1", measure.expression().text());
        assertEquals("0", measure.propertyValue("formatString"));
    }

    @Test
    void testFencedExpression() throws Exception {
        String text = String.join("\n",
                "table T",
                "\tmeasure M = ```",
                "\t\t\t1 + 1",
                "\t\t\t```",
                "\tcolumn C",
                "");
        TmdlNode table = parser.parse(file, text).roots().get(0);

        TmdlExpression expression = table.children().get(0).expression();
        assertTrue(expression.fenced());
        assertEquals("\t\t\t1 + 1", expression.text());
        assertEquals("C", table.children().get(1).name());
    }

    @Test
    void testQuotedNameWithEscapedQuote() throws Exception {
        TmdlNode table = parser.parse(file, "table 'Bob''s Sales'\n").roots().get(0);
        assertEquals("Bob's Sales", table.name());
        assertEquals("'Bob''s Sales'", table.nameToken().span().slice("table 'Bob''s Sales'\n"));
    }

    // ===== Ссылки в свойствах =====

    @Test
    void testRelationshipReferences() throws Exception {
        String text = String.join("\n",
                "relationship r1",
                "\tfromColumn: 'Fact Sales'.'Customer Id'",
                "\ttoColumn: Customer.CustomerId",
                "");
        TmdlNode relationship = parser.parse(file, text).roots().get(0);

        List<TmdlNameToken> from = relationship.property("fromColumn").orElseThrow().references();
        assertEquals(List.of("Fact Sales", "Customer Id"), from.stream().map(TmdlNameToken::value).toList());
        List<TmdlNameToken> to = relationship.property("toColumn").orElseThrow().references();
        assertEquals(List.of("Customer", "CustomerId"), to.stream().map(TmdlNameToken::value).toList());
        assertFalse(to.get(0).quoted());
    }

    @Test
    void testRefAndSortBy() throws Exception {
        TmdlNode ref = parser.parse(file, TestProjects.MODEL_TMDL).roots().get(1);
        assertEquals(TmdlNodeKind.REF, ref.kind());
        assertEquals("table", ref.refKind());
        assertEquals("Sales", ref.name());

        TmdlNode name = parser.parse(file, TestProjects.CUSTOMER_TMDL).roots().get(0).children().get(1);
        assertEquals("CustomerId", name.property("sortByColumn").orElseThrow().references().get(0).value());
    }

    // ===== Выражения DAX =====

    @Test
    void testDaxExpressions_ImportPartitionIsNotDax() throws Exception {
        List<DaxExpressionSite> sites = parser.parse(file, TestProjects.SALES_TMDL).daxExpressions();

        assertEquals(2, sites.size());
        assertEquals("measure 'Total Sales'", sites.get(0).location());
        assertEquals("Sales", sites.get(0).owningTable());
    }

    @Test
    void testDaxExpressions_CalculatedPartition() throws Exception {
        String text = String.join("\n",
                "table Calc",
                "\tpartition Calc = calculated",
                "\t\tsource = FILTER(Sales, Sales[Amount] > 0)",
                "");
        List<DaxExpressionSite> sites = parser.parse(file, text).daxExpressions();

        assertEquals(1, sites.size());
        assertEquals("FILTER(Sales, Sales[Amount] > 0)", sites.get(0).expression().text());
        assertEquals("Calc", sites.get(0).owningTable());
    }

    // ===== Ошибки =====

    @Test
    void testUnterminatedQuotedName() {
        ModelParseException e = assertThrows(ModelParseException.class, () -> parser.parse(file, "table 'Sales\n"));
        assertEquals(1, e.getLine());
        assertEquals(7, e.getColumn());
        assertTrue(e.getDetail().contains("Unterminated quoted name"));
    }

    @Test
    void testPropertyOutsideObject() {
        ModelParseException e = assertThrows(ModelParseException.class, () -> parser.parse(file, "formatString: 0\n"));
        assertTrue(e.getDetail().contains("outside of any object"));
    }

    @Test
    void testTextAfterQuotedName() {
        ModelParseException e = assertThrows(ModelParseException.class, () ->
                parser.parse(file, "table T\n\tcolumn 'A' B\n"));
        assertEquals(2, e.getLine());
        assertTrue(e.getDetail().contains("Unexpected text after name"));
    }

    @Test
    void testUnterminatedFence() {
        ModelParseException e = assertThrows(ModelParseException.class, () ->
                parser.parse(file, "table T\n\tmeasure M = ```\n\t\t1 + 1\n"));
        assertTrue(e.getDetail().contains("Unterminated"));
        assertEquals(file, e.getFile());
    }
}
