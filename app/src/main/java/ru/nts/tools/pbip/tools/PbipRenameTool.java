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
import ru.nts.tools.pbip.graph.IdentifierKind;
import ru.nts.tools.pbip.graph.ResolutionIssue;
import ru.nts.tools.pbip.rename.CommitResult;
import ru.nts.tools.pbip.rename.Conflict;
import ru.nts.tools.pbip.rename.ImpactReport;
import ru.nts.tools.pbip.rename.PbipRenameEngine;
import ru.nts.tools.pbip.rename.RenameMapping;
import ru.nts.tools.pbip.rename.RenameRequest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Переименование таблиц, колонок и мер во всем проекте (модель и отчет).
 * С {@code dryRun=true} возвращает только отчет о влиянии.
 */
public class PbipRenameTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ProjectEngines engines;

    public PbipRenameTool(ProjectEngines engines) {
        this.engines = engines;
    }

    @Override
    public String getName() {
        return "pbip_rename";
    }

    @Override
    public String getDescription() {
        return """
                Rename tables, columns and measures across the semantic model (TMDL) and report JSON.
                Batch is atomic: all files are rewritten or none. Swaps and chains are allowed.
                Use dryRun=true to see affected files and conflicts first.
                """;
    }

    @Override
    public JsonNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("projectPath").put("type", "string")
                .put("description", "Path to the .pbip file or the project folder.");

        ObjectNode renames = props.putObject("renames");
        renames.put("type", "array").put("minItems", 1)
                .put("description", "Renames applied together as one batch.");
        ObjectNode item = renames.putObject("items");
        item.put("type", "object");
        ObjectNode itemProps = item.putObject("properties");
        itemProps.putObject("kind").put("type", "string").putArray("enum").add("table").add("column").add("measure");
        itemProps.putObject("oldName").put("type", "string")
                .put("description", "Current name: Sales, 'Sales'[Amount], Sales.Amount or a bare measure name.");
        itemProps.putObject("newName").put("type", "string").put("description", "New name without table.");
        item.putArray("required").add("kind").add("oldName").add("newName");
        item.put("additionalProperties", false);

        props.putObject("dryRun").put("type", "boolean").put("default", false)
                .put("description", "Only report impact, write nothing.");
        props.putObject("allowPartial").put("type", "boolean").put("default", false)
                .put("description", "Skip unresolved references that mention renamed names instead of refusing.");
        schema.putArray("required").add("projectPath").add("renames");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        PbipRenameEngine engine = engines.get(params.path("projectPath").asText(null));
        boolean dryRun = params.path("dryRun").asBoolean(false);
        boolean allowPartial = params.has("allowPartial")
                ? params.get("allowPartial").asBoolean()
                : engines.getSettings().isAllowPartialByDefault();
        RenameRequest request = new RenameRequest(parseMappings(params.get("renames")), allowPartial);

        ObjectNode result = mapper.createObjectNode();
        ObjectNode structured = result.putObject("structuredContent");
        String text;
        if (dryRun) {
            ImpactReport report = engine.scanImpact(request);
            writeReport(structured.putObject("impact"), report);
            structured.put("committed", false);
            text = summarize(report);
        } else {
            CommitResult commit = engine.applyRename(request);
            writeReport(structured.putObject("impact"), commit.report());
            structured.put("committed", true);
            ArrayNode files = structured.putArray("committedFiles");
            commit.committedFiles().forEach(f -> files.add(f.toString()));
            structured.put("occurrences", commit.occurrences());
            commit.backup().ifPresent(b -> structured.put("backup", b.toString()));
            text = "Renamed " + String.join("; ", commit.mappings()) + ": " + commit.occurrences()
                    + " occurrence(s) in " + commit.committedFiles().size() + " file(s)."
                    + commit.backup().map(b -> "\nBackup: " + b).orElse("");
        }
        result.putArray("content").addObject().put("type", "text").put("text", text);
        return result;
    }

    private static List<RenameMapping> parseMappings(JsonNode renames) {
        if (renames == null || !renames.isArray() || renames.isEmpty()) {
            throw new IllegalArgumentException("renames must be a non-empty array");
        }
        List<RenameMapping> mappings = new ArrayList<>();
        for (JsonNode item : renames) {
            String kind = item.path("kind").asText("");
            IdentifierKind identifierKind;
            try {
                identifierKind = IdentifierKind.valueOf(kind.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown kind '" + kind + "', expected table, column or measure", e);
            }
            mappings.add(new RenameMapping(identifierKind, item.path("oldName").asText(null), item.path("newName").asText(null)));
        }
        return mappings;
    }

    private static void writeReport(ObjectNode node, ImpactReport report) {
        if (report == null) {
            return;
        }
        ArrayNode mappings = node.putArray("mappings");
        report.mappings().forEach(mappings::add);
        ArrayNode files = node.putArray("files");
        for (ImpactReport.FileImpact file : report.files()) {
            files.addObject()
                    .put("file", file.file().toString())
                    .put("family", file.family().name())
                    .put("occurrences", file.occurrences());
        }
        node.put("totalOccurrences", report.totalOccurrences());
        node.put("blocked", report.blocked());
        ArrayNode conflicts = node.putArray("conflicts");
        for (Conflict conflict : report.conflicts()) {
            ObjectNode c = conflicts.addObject();
            c.put("type", conflict.type().name());
            c.put("message", conflict.message());
            ArrayNode conflictFiles = c.putArray("files");
            for (Path f : conflict.files()) {
                conflictFiles.add(f.toString());
            }
            ArrayNode ids = c.putArray("identifiers");
            conflict.identifiers().forEach(ids::add);
        }
        ArrayNode warnings = node.putArray("warnings");
        report.warnings().forEach(warnings::add);
        ArrayNode excluded = node.putArray("excluded");
        for (ResolutionIssue issue : report.excluded()) {
            excluded.add(issue.toString());
        }
    }

    private static String summarize(ImpactReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Impact of ").append(String.join("; ", report.mappings())).append('\n');
        for (ImpactReport.FileImpact file : report.files()) {
            sb.append("  ").append(file.file().getFileName()).append(": ").append(file.occurrences()).append('\n');
        }
        sb.append("Total: ").append(report.totalOccurrences()).append(" occurrence(s)");
        if (report.blocked()) {
            sb.append("\nBLOCKED by ").append(report.conflicts().size()).append(" conflict(s):");
            report.conflicts().forEach(c -> sb.append("\n  - ").append(c));
        }
        report.warnings().forEach(w -> sb.append("\n  ! ").append(w));
        return sb.toString();
    }
}
