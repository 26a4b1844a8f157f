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
package ru.nts.tools.pbip.report.shapes;

import org.junit.jupiter.api.Test;
import ru.nts.tools.pbip.graph.ResolutionIssue;
import ru.nts.tools.pbip.report.BindingDocument;
import ru.nts.tools.pbip.report.BindingParser;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты распознавания ссылок на модель в JSON отчета.
 */
class ShapeRegistryTest {

    private static final Path FILE = Path.of("visual.json");

    private final ShapeRegistry registry = ShapeRegistry.defaults();

    private ShapeScan scan(String json) throws Exception {
        return registry.scan(new BindingParser().parse(FILE, json.replace('\'', '"')));
    }

    private static List<BindingReference> of(ShapeScan scan, ShapeKind kind) {
        return scan.references().stream().filter(r -> r.shape() == kind).collect(Collectors.toList());
    }

    @Test
    void testEntity() throws Exception {
        ShapeScan scan = scan("{'SourceRef': {'Entity': 'Sales'}}");

        BindingReference ref = scan.references().get(0);
        assertEquals(ShapeKind.ENTITY, ref.shape());
        assertEquals("Sales", ref.table());
        assertEquals("Sales", ref.text());
        assertTrue(ref.isTableReference());
        assertTrue(scan.issues().isEmpty());
    }

    @Test
    void testPropertyExpressionWithFromAlias() throws Exception {
        ShapeScan scan = scan("{'From': [{'Name': 's', 'Entity': 'Sales', 'Type': 0}],"
                + " 'Select': [{'Measure': {'Expression': {'SourceRef': {'Source': 's'}}, 'Property': 'Total Sales'},"
                + " 'Name': 'Sales.Total Sales'}]}");

        assertEquals(1, of(scan, ShapeKind.ENTITY).size());

        BindingReference property = of(scan, ShapeKind.PROPERTY_EXPRESSION).get(0);
        assertEquals("Sales", property.table());
        assertEquals("Total Sales", property.member());
        assertEquals(BindingReference.MemberHint.MEASURE, property.hint());
        assertFalse(property.isTableReference());

        // Name элемента From - псевдоним, а не ссылка
        List<BindingReference> queryRefs = of(scan, ShapeKind.QUERY_REF);
        assertEquals(1, queryRefs.size());
        assertEquals("Sales.Total Sales", queryRefs.get(0).text());
        assertTrue(scan.issues().isEmpty());
    }

    @Test
    void testUndeclaredAliasIsNotAnalyzable() throws Exception {
        ShapeScan scan = scan("{'Column': {'Expression': {'SourceRef': {'Source': 't'}}, 'Property': 'Amount'}}");

        assertTrue(scan.references().isEmpty());
        ResolutionIssue issue = scan.issues().get(0);
        assertEquals(ResolutionIssue.IssueKind.NOT_ANALYZABLE, issue.kind());
        assertEquals("Amount", issue.spelledMember());
        assertEquals(FILE, issue.file());
    }

    @Test
    void testQueryRefWithAggregateAndNativeName() throws Exception {
        ShapeScan scan = scan("{'queryRef': 'Sum(Sales.Amount)', 'nativeQueryRef': 'Sum of Amount'}");

        BindingReference queryRef = of(scan, ShapeKind.QUERY_REF).get(0);
        assertEquals("Sales.Amount", queryRef.text());
        assertEquals(4, queryRef.start());
        assertNull(queryRef.table());

        BindingReference nativeRef = of(scan, ShapeKind.NATIVE_QUERY_REF).get(0);
        assertEquals("Sum of Amount", nativeRef.text());
        assertEquals("Sales.Amount", nativeRef.companion().text());
        assertFalse(nativeRef.isTableReference());
    }

    @Test
    void testQueryRefWithoutMemberIsReported() throws Exception {
        ShapeScan scan = scan("{'queryRef': 'Amount', 'nativeQueryRef': 'Amount'}");

        assertTrue(scan.references().isEmpty());
        assertEquals(1, scan.issues().size());
        assertEquals("$.queryRef", scan.issues().get(0).location());
    }

    @Test
    void testColumnPropertiesKeysAndSelector() throws Exception {
        ShapeScan scan = scan("{'columnProperties': {'Customer.Name': {'displayName': 'Client'}},"
                + " 'selector': {'metadata': 'Sales.Total Sales'}, 'other': {'metadata': 'ignored'}}");

        List<String> refs = of(scan, ShapeKind.QUERY_REF).stream().map(BindingReference::text).collect(Collectors.toList());
        assertEquals(List.of("Customer.Name", "Sales.Total Sales"), refs);
        assertTrue(of(scan, ShapeKind.QUERY_REF).get(0).token().isKey());
    }

    @Test
    void testFilterTarget() throws Exception {
        ShapeScan scan = scan("{'target': {'table': 'Sales', 'column': 'Region'}}");

        List<BindingReference> refs = of(scan, ShapeKind.FILTER_TARGET);
        assertEquals(2, refs.size());
        assertTrue(refs.get(0).isTableReference());
        assertEquals("Region", refs.get(1).member());
        assertEquals(BindingReference.MemberHint.COLUMN, refs.get(1).hint());
    }

    @Test
    void testEmbeddedConfigIsWalked() throws Exception {
        String inner = "{\"singleVisual\": {\"SourceRef\": {\"Entity\": \"Sales\"}}}";
        ShapeScan scan = registry.scan(new BindingParser().parse(FILE,
                "{\"config\": " + BindingDocument.encode(inner) + "}"));

        BindingReference entity = of(scan, ShapeKind.ENTITY).get(0);
        assertEquals("Sales", entity.table());
        assertEquals(1, entity.token().owner().depth());
    }

    @Test
    void testMalformedEmbeddedIsNotAnalyzable() throws Exception {
        ShapeScan scan = scan("{'config': '{\\'broken'}");

        assertEquals(1, scan.issues().size());
        assertEquals(ResolutionIssue.IssueKind.NOT_ANALYZABLE, scan.issues().get(0).kind());
        assertEquals("$.config", scan.issues().get(0).location());
    }

    @Test
    void testDuplicateKeyRegistrationRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ShapeRegistry(List.of(new EntityShape(), new EntityShape())));
    }
}
