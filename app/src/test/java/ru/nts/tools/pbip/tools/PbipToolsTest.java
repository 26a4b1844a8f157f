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
package ru.nts.tools.pbip.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import ru.nts.tools.pbip.TestProjects;
import ru.nts.tools.pbip.core.PbipSettings;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты инструментов: схемы входных параметров и структура ответов.
 */
class PbipToolsTest {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private static final String META_SCHEMA = """
            {
              "$schema": "http://json-schema.org/draft-07/schema#",
              "type": "object",
              "required": ["type", "properties"],
              "properties": {
                "type": { "const": "object" },
                "properties": { "type": "object" },
                "required": { "type": "array", "items": { "type": "string" } }
              }
            }
            """;

    @TempDir
    Path tempDir;

    private Path root;
    private Map<String, McpTool> tools;

    static Stream<McpTool> toolProvider() {
        return PbipTools.create(PbipSettings.builder().build()).stream();
    }

    @BeforeEach
    void setUp() throws Exception {
        root = TestProjects.createShop(tempDir);
        tools = PbipTools.create(PbipSettings.builder().build()).stream()
                .collect(Collectors.toMap(McpTool::getName, t -> t));
    }

    private ObjectNode params() {
        ObjectNode params = mapper.createObjectNode();
        params.put("projectPath", root.resolve("Shop.pbip").toString());
        return params;
    }

    private static Set<ValidationMessage> validate(McpTool tool, JsonNode params) {
        JsonSchema schema = schemaFactory.getSchema(tool.getInputSchema());
        return schema.validate(params);
    }

    // ===== Схемы =====

    @ParameterizedTest(name = "{0}")
    @MethodSource("toolProvider")
    void testSchemaIsValidAgainstMetaSchema(McpTool tool) throws Exception {
        JsonSchema validator = schemaFactory.getSchema(mapper.readTree(META_SCHEMA));
        Set<ValidationMessage> errors = validator.validate(tool.getInputSchema());

        assertTrue(errors.isEmpty(), tool.getName() + ": " + errors);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("toolProvider")
    void testRequiredFieldsAreDeclared(McpTool tool) {
        JsonNode schema = tool.getInputSchema();
        List<String> missing = new ArrayList<>();
        for (JsonNode field : schema.path("required")) {
            if (!schema.path("properties").has(field.asText())) {
                missing.add(field.asText());
            }
        }
        assertTrue(missing.isEmpty(), tool.getName() + " requires undeclared fields: " + missing);
        assertFalse(tool.getDescription().isBlank());
        assertTrue(tool.getName().startsWith("pbip_"));
    }

    @Test
    void testRenameSchemaRejectsBadItems() throws Exception {
        McpTool rename = tools.get("pbip_rename");

        JsonNode good = mapper.readTree("{\"projectPath\": \"x\", \"renames\": [{\"kind\": \"table\", \"oldName\": \"A\", \"newName\": \"B\"}]}");
        assertTrue(validate(rename, good).isEmpty());

        JsonNode badKind = mapper.readTree("{\"projectPath\": \"x\", \"renames\": [{\"kind\": \"view\", \"oldName\": \"A\", \"newName\": \"B\"}]}");
        assertFalse(validate(rename, badKind).isEmpty());

        JsonNode empty = mapper.readTree("{\"projectPath\": \"x\", \"renames\": []}");
        assertFalse(validate(rename, empty).isEmpty());
    }

    // ===== pbip_rename =====

    @Test
    void testRenameDryRunThenCommit() throws Exception {
        McpTool rename = tools.get("pbip_rename");
        ObjectNode params = params();
        params.putArray("renames").addObject().put("kind", "measure").put("oldName", "[Total Sales]").put("newName", "Revenue");
        params.put("dryRun", true);
        assertTrue(validate(rename, params).isEmpty());

        JsonNode dry = rename.executeWithFeedback(params);
        assertFalse(dry.path("isError").asBoolean(false), dry.toString());
        JsonNode impact = dry.path("structuredContent").path("impact");
        assertEquals(5, impact.path("totalOccurrences").asInt());
        assertFalse(impact.path("blocked").asBoolean());
        assertFalse(dry.path("structuredContent").path("committed").asBoolean());
        assertTrue(dry.path("content").get(0).path("text").asText().startsWith("Impact of "));
        assertEquals(TestProjects.SALES_TMDL, TestProjects.read(TestProjects.model(root, "tables/Sales.tmdl")));

        params.put("dryRun", false);
        JsonNode committed = rename.executeWithFeedback(params);
        JsonNode structured = committed.path("structuredContent");
        assertTrue(structured.path("committed").asBoolean(), committed.toString());
        assertEquals(2, structured.path("committedFiles").size());
        assertEquals(5, structured.path("occurrences").asInt());
        assertTrue(TestProjects.read(TestProjects.visual(root)).contains("\"queryRef\": \"Sales.Revenue\""));
    }

    @Test
    void testRenameConflictIsStructuredError() throws Exception {
        McpTool rename = tools.get("pbip_rename");
        ObjectNode params = params();
        params.putArray("renames").addObject().put("kind", "table").put("oldName", "Sales").put("newName", "customer");

        JsonNode response = rename.executeWithFeedback(params);

        assertTrue(response.path("isError").asBoolean());
        assertEquals("NAME_COLLISION", response.path("error").path("code").asText());
        assertTrue(response.path("error").path("suggestions").size() > 0);
        assertTrue(response.path("content").get(0).path("text").asText().startsWith("[ERROR: NAME_COLLISION]"));
    }

    @Test
    void testRenameInvalidParameters() {
        McpTool rename = tools.get("pbip_rename");
        ObjectNode params = params();
        params.putArray("renames").addObject().put("kind", "view").put("oldName", "Sales").put("newName", "X");

        JsonNode response = rename.executeWithFeedback(params);
        assertEquals("INVALID_REQUEST", response.path("error").path("code").asText());

        ObjectNode missingProject = mapper.createObjectNode();
        missingProject.putArray("renames");
        assertEquals("INVALID_REQUEST", rename.executeWithFeedback(missingProject).path("error").path("code").asText());
    }

    @Test
    void testUnknownProject() {
        ObjectNode params = mapper.createObjectNode();
        params.put("projectPath", tempDir.resolve("missing").toString());

        JsonNode response = tools.get("pbip_project_info").executeWithFeedback(params);

        assertEquals("PROJECT_NOT_FOUND", response.path("error").path("code").asText());
    }

    // ===== pbip_validate и pbip_project_info =====

    @Test
    void testValidateWithFix() throws Exception {
        Path leads = TestProjects.model(root, "tables/Leads.tmdl");
        TestProjects.write(leads, "table 'Leads Sales Data'\n\n\tcolumn Amount\n\t\tdataType: decimal\n\n"
                + "\tmeasure 'Lead Amount' = SUM(Leads Sales Data[Amount])\n");
        McpTool validate = tools.get("pbip_validate");
        ObjectNode params = params();

        JsonNode report = validate.executeWithFeedback(params);
        assertEquals(1, report.path("structuredContent").path("diagnostics").size(), report.toString());
        assertEquals("UNQUOTED_TABLE_IN_DAX", report.path("structuredContent").path("diagnostics").get(0).path("type").asText());

        params.put("fix", true);
        JsonNode fixed = validate.executeWithFeedback(params);
        assertTrue(fixed.path("structuredContent").path("fix").path("applied").asBoolean(), fixed.toString());
        assertEquals(1, fixed.path("structuredContent").path("fix").path("total").asInt());
        assertTrue(TestProjects.read(leads).contains("SUM('Leads Sales Data'[Amount])"));

        params.put("fix", false);
        assertEquals(0, validate.executeWithFeedback(params).path("structuredContent").path("diagnostics").size());
    }

    @Test
    void testProjectInfo() {
        JsonNode response = tools.get("pbip_project_info").executeWithFeedback(params());
        JsonNode s = response.path("structuredContent");

        assertEquals("Shop", s.path("name").asText());
        assertEquals(4, s.path("modelFiles").asInt());
        assertEquals(3, s.path("reportFiles").asInt());
        assertEquals(2, s.path("tables").asInt());
        assertEquals(3, s.path("measures").asInt());
        assertEquals(0, s.path("unresolved").asInt());
        assertEquals(1, s.path("reports").size());
        assertTrue(response.path("content").get(0).path("text").asText().startsWith("Project Shop:"));
    }
}
