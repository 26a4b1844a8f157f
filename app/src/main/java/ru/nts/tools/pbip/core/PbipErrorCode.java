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
package ru.nts.tools.pbip.core;

import java.util.Map;

/**
 * Structured error codes for the PBIP rename engine.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example rendering:
 * <pre>
 * [ERROR: NAME_COLLISION]
 * Message: Resulting name is not unique in its scope
 * Solution: Choose another name for 'Sales'[Amount]. ...
 * Context: scope=Sales, name=Revenue
 * </pre>
 */
public enum PbipErrorCode {

    // ============ Input Errors ============

    PARSE_ERROR("Malformed project file",
            "Fix the syntax at %file%:%line% and retry. Files are never auto-repaired."),

    PROJECT_NOT_FOUND("PBIP project not found",
            "Pass a .pbip file or a folder containing one next to its *.SemanticModel folder."),

    FILE_NOT_READABLE("File not readable",
            "Check file permissions. Ensure the file is not locked."),

    FILE_TOO_LARGE("File too large",
            "File exceeds %maxAllowed% bytes. Raise PBIP_MAX_FILE_SIZE if the file is legitimate."),

    // ============ Request Errors ============

    INVALID_REQUEST("Invalid rename request",
            "Each rename needs kind (table|column|measure), oldName and newName."),

    IDENTIFIER_NOT_FOUND("Identifier to rename does not exist",
            "Check spelling of '%identifier%'. Names are matched case-insensitively."),

    AMBIGUOUS_IDENTIFIER("Identifier to rename is ambiguous",
            "Qualify the name with its table, e.g. 'Table'[%identifier%]."),

    // ============ Plan Errors ============

    NAME_COLLISION("Resulting name is not unique in its scope",
            "Choose names that do not clash with sibling identifiers after the whole batch is applied."),

    UNRESOLVED_REFERENCE("Reference target could not be determined",
            "Fix or qualify the listed references, or retry with allowPartial=true to skip them."),

    AMBIGUOUS_REFERENCE("Bare reference matches several identifiers",
            "Qualify the reference with its table ('Table'[Name]) so it resolves to one identifier."),

    // ============ Commit Errors ============

    EXTERNAL_MUTATION("File changed on disk since it was scanned",
            "Another process modified %file%. Re-run the scan and retry the rename."),

    PARTIAL_WRITE("Write failed during commit; all files were restored",
            "Check disk space and permissions for %file%, then retry."),

    ROLLBACK_FAILED("Rollback could not restore every file",
            "CRITICAL: restore the listed files from backup or version control before further edits."),

    VALIDATION_FAILED("Staged output failed validation",
            "The rename would produce an inconsistent project. Nothing was written."),

    GRAPH_INVALIDATED("Dependency graph is stale",
            "A rename was committed after this graph was built. Rebuild before the next rename."),

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Check logs for details.");

    private final String message;
    private final String solution;

    PbipErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Подставляет значения контекста в подсказку (%key% плейсхолдеры).
     */
    public String resolveSolution(Map<String, Object> context) {
        String resolved = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolved = resolved.replace("%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Очищаем неиспользованные плейсхолдеры
        return resolved.replaceAll("%\\w+%", "...");
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (file, line, identifier, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));
        sb.append(String.format("Solution: %s", resolveSolution(context)));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    public String format() {
        return format(null);
    }
}
