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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.pbip.rename.PbipRenameEngine;
import ru.nts.tools.pbip.rename.QuotingFix;
import ru.nts.tools.pbip.tmdl.TmdlDiagnostic;

import java.util.List;

/**
 * Проверка кавычек в TMDL и DAX; с {@code fix=true} исправляет имена таблиц без кавычек в DAX.
 */
public class PbipValidateTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ProjectEngines engines;

    public PbipValidateTool(ProjectEngines engines) {
        this.engines = engines;
    }

    @Override
    public String getName() {
        return "pbip_validate";
    }

    @Override
    public String getDescription() {
        return "Find names with spaces that lack quotes in TMDL and DAX. fix=true quotes table names in DAX.";
    }

    @Override
    public JsonNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("projectPath").put("type", "string")
                .put("description", "Path to the .pbip file or the project folder.");
        props.putObject("fix").put("type", "boolean").put("default", false)
                .put("description", "Quote table names in DAX expressions.");
        props.putObject("dryRun").put("type", "boolean").put("default", false)
                .put("description", "With fix: count fixes, write nothing.");
        schema.putArray("required").add("projectPath");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        PbipRenameEngine engine = engines.get(params.path("projectPath").asText(null));
        List<TmdlDiagnostic> diagnostics = engine.validate();

        ObjectNode result = mapper.createObjectNode();
        ObjectNode structured = result.putObject("structuredContent");
        ArrayNode items = structured.putArray("diagnostics");
        StringBuilder sb = new StringBuilder();
        sb.append(diagnostics.isEmpty() ? "No quoting problems found." : diagnostics.size() + " problem(s):");
        for (TmdlDiagnostic diagnostic : diagnostics) {
            items.addObject()
                    .put("file", diagnostic.file().toString())
                    .put("line", diagnostic.line())
                    .put("type", diagnostic.type().name())
                    .put("message", diagnostic.message())
                    .put("context", diagnostic.context());
            sb.append("\n  ").append(diagnostic);
        }

        if (params.path("fix").asBoolean(false)) {
            QuotingFix fix = engine.fixDaxQuoting(params.path("dryRun").asBoolean(false));
            ObjectNode fixNode = structured.putObject("fix");
            fixNode.put("total", fix.total());
            fixNode.put("applied", fix.applied());
            ObjectNode perFile = fixNode.putObject("files");
            fix.fixes().forEach((path, count) -> perFile.put(path.toString(), count));
            sb.append("\n").append(fix.applied() ? "Fixed " : "Would fix ").append(fix.total()).append(" table reference(s).");
        }
        result.putArray("content").addObject().put("type", "text").put("text", sb.toString());
        return result;
    }
}
