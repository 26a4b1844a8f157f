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
import ru.nts.tools.pbip.rename.ProjectInfo;

/**
 * Сводка по проекту: файлы, количество идентификаторов и ссылок, проблемы разрешения.
 */
public class PbipProjectInfoTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ProjectEngines engines;

    public PbipProjectInfoTool(ProjectEngines engines) {
        this.engines = engines;
    }

    @Override
    public String getName() {
        return "pbip_project_info";
    }

    @Override
    public String getDescription() {
        return "Summary of a PBIP project: model and report files, tables, columns, measures, reference issues.";
    }

    @Override
    public JsonNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("projectPath").put("type", "string")
                .put("description", "Path to the .pbip file or the project folder.");
        schema.putArray("required").add("projectPath");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        ProjectInfo info = engines.get(params.path("projectPath").asText(null)).projectInfo();

        ObjectNode result = mapper.createObjectNode();
        ObjectNode s = result.putObject("structuredContent");
        s.put("name", info.name());
        s.put("root", info.root().toString());
        s.put("semanticModel", info.semanticModel().toString());
        ArrayNode reports = s.putArray("reports");
        info.reports().forEach(r -> reports.add(r.toString()));
        s.put("modelFiles", info.modelFiles());
        s.put("reportFiles", info.reportFiles());
        s.put("tables", info.tables());
        s.put("columns", info.columns());
        s.put("measures", info.measures());
        s.put("references", info.references());
        s.put("unresolved", info.unresolved());
        s.put("ambiguous", info.ambiguous());
        s.put("notAnalyzable", info.notAnalyzable());

        String text = String.format("Project %s: %d model file(s), %d report file(s); %d table(s), %d column(s), %d measure(s); "
                        + "%d reference(s), %d unresolved, %d ambiguous, %d not analyzable",
                info.name(), info.modelFiles(), info.reportFiles(), info.tables(), info.columns(), info.measures(),
                info.references(), info.unresolved(), info.ambiguous(), info.notAnalyzable());
        result.putArray("content").addObject().put("type", "text").put("text", text);
        return result;
    }
}
