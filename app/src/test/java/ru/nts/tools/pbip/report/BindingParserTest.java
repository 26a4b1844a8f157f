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
package ru.nts.tools.pbip.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.nts.tools.pbip.core.ModelParseException;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты разбора JSON отчета с сохранением положений строк.
 */
class BindingParserTest {

    private static final Path FILE = Path.of("visual.json");

    private final BindingParser parser = new BindingParser();

    /** Одинарные кавычки вместо двойных, чтобы не экранировать каждую. */
    private static String json(String text) {
        return text.replace('\'', '"');
    }

    private static JsonStringToken token(BindingDocument doc, String path, boolean key) {
        return doc.tokens().stream()
                .filter(t -> t.path().equals(path) && t.isKey() == key)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No token at " + path));
    }

    // ===== Токены =====

    @Test
    void testStringTokensKeepSourcePositions() throws Exception {
        String source = "{\n  \"a\": \"x\\\"y\",\n  \"b\": [1, \"z\", true]\n}";
        BindingDocument doc = parser.parse(FILE, source);

        JsonStringToken value = token(doc, "$.a", false);
        assertEquals("x\"y", value.value());
        assertEquals("\"x\\\"y\"", source.substring(value.start(), value.end()));
        assertEquals(2, value.line());

        JsonStringToken key = token(doc, "$.b", true);
        assertEquals("\"b\"", source.substring(key.start(), key.end()));

        JsonStringToken element = token(doc, "$.b[1]", false);
        assertEquals("z", element.value());
        assertEquals("\"z\"", source.substring(element.start(), element.end()));
        assertSame(doc, element.owner());
    }

    @Test
    void testTreeNavigation() throws Exception {
        BindingDocument doc = parser.parse(FILE, json("{'visual': {'query': {'Entity': 'Sales'}}, 'n': null}"));

        BindingNode entity = doc.root().member("visual").flatMap(v -> v.member("query"))
                .flatMap(q -> q.stringMember("Entity")).orElseThrow();
        assertEquals("Sales", entity.stringValue());
        assertEquals("$.visual.query.Entity", entity.path());
        assertEquals("Entity", entity.keyInParent());
        assertEquals(BindingNode.Kind.NULL, doc.root().member("n").orElseThrow().kind());
        assertTrue(doc.root().stringMember("n").isEmpty());
    }

    // ===== Запись =====

    @Test
    void testWriteReplacesOnlyGivenTokens() throws Exception {
        String source = json("{ 'Entity' :  'Sales',\n\t'other': 'Sales', 'x': 1.50 }");
        BindingDocument doc = parser.parse(FILE, source);

        assertEquals(source, doc.write());
        assertEquals(source, doc.write(Map.of()));

        String written = doc.write(Map.of(token(doc, "$.Entity", false), "Fact \"Sales\""));
        assertEquals("{ \"Entity\" :  \"Fact \\\"Sales\\\"\",\n\t\"other\": \"Sales\", \"x\": 1.50 }", written);
    }

    @Test
    void testEncode() {
        assertEquals("\"a\\\\b\\\"c\\n\"", BindingDocument.encode("a\\b\"c\n"));
        assertEquals("\"Продажи\"", BindingDocument.encode("Продажи"));
    }

    // ===== Вложенный JSON =====

    @Test
    void testEmbeddedConfigIsParsed() throws Exception {
        String inner = json("{'name': 'v1', 'singleVisual': {'Entity': 'Sales'}}");
        String source = "{\"config\": " + BindingDocument.encode(inner) + ", \"x\": 10}";
        BindingDocument doc = parser.parse(FILE, source);

        BindingNode config = doc.root().member("config").orElseThrow();
        BindingDocument embedded = config.embedded();
        assertNotNull(embedded);
        assertEquals(1, embedded.depth());
        assertSame(config.token(), embedded.parentToken());
        assertEquals(inner, embedded.source());

        JsonStringToken entity = token(embedded, "$.config.singleVisual.Entity", false);
        assertEquals("Sales", entity.value());
        assertSame(embedded, entity.owner());
        // токены вложенного документа не попадают во внешний
        assertTrue(doc.tokens().stream().noneMatch(t -> t == entity));
    }

    @Test
    void testEmbeddedRewriteRoundsThroughOuterString() throws Exception {
        String inner = json("{'singleVisual': {'Entity': 'Sales', 'title': 'a\\\\b'}}");
        String source = "{\"config\": " + BindingDocument.encode(inner) + "}";
        BindingDocument doc = parser.parse(FILE, source);
        BindingNode config = doc.root().member("config").orElseThrow();
        BindingDocument embedded = config.embedded();

        String newInner = embedded.write(Map.of(token(embedded, "$.config.singleVisual.Entity", false), "Orders"));
        String written = doc.write(Map.of(config.token(), newInner));

        JsonNode outer = new ObjectMapper().readTree(written);
        JsonNode parsedInner = new ObjectMapper().readTree(outer.get("config").asText());
        assertEquals("Orders", parsedInner.at("/singleVisual/Entity").asText());
        assertEquals("a\\b", parsedInner.at("/singleVisual/title").asText());
    }

    @Test
    void testMalformedEmbeddedIsRecorded() throws Exception {
        BindingDocument doc = parser.parse(FILE, json("{'config': '{not json', 'query': 'plain text'}"));

        assertNull(doc.root().member("config").orElseThrow().embedded());
        assertNull(doc.root().member("query").orElseThrow().embedded());
        assertEquals(1, doc.embeddedFailures().size());
        assertEquals("$.config", doc.embeddedFailures().get(0).token().path());
    }

    @Test
    void testEmbeddedKeysOnlyForStrings() throws Exception {
        BindingDocument doc = parser.parse(FILE, json("{'query': {'queryState': {}}, 'filters': '[]'}"));

        assertEquals(BindingNode.Kind.OBJECT, doc.root().member("query").orElseThrow().kind());
        BindingDocument filters = doc.root().member("filters").orElseThrow().embedded();
        assertNotNull(filters);
        assertEquals(BindingNode.Kind.ARRAY, filters.root().kind());
        assertTrue(doc.embeddedFailures().isEmpty());
    }

    // ===== Ошибки =====

    @Test
    void testSyntaxErrors() {
        ModelParseException e = assertThrows(ModelParseException.class,
                () -> parser.parse(FILE, "{\n  \"a\": \n}"));
        assertEquals(FILE, e.getFile());
        assertEquals(3, e.getLine());

        assertThrows(ModelParseException.class, () -> parser.parse(FILE, ""));
        assertThrows(ModelParseException.class, () -> parser.parse(FILE, "{} {}"));
    }
}
