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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base exception of the rename engine.
 * Carries a structured error code, context values and the exact files and
 * identifiers implicated, so callers can show what would break.
 *
 * <p>Usage:
 * <pre>
 * throw new PbipException(PbipErrorCode.IDENTIFIER_NOT_FOUND, Map.of("identifier", "Sales"));
 * </pre>
 */
public class PbipException extends Exception {

    private final PbipErrorCode code;
    private final Map<String, Object> context;
    private final List<Path> files = new ArrayList<>();
    private final List<String> identifiers = new ArrayList<>();
    private final List<String> suggestions = new ArrayList<>();

    public PbipException(PbipErrorCode code) {
        this(code, Collections.emptyMap(), null);
    }

    public PbipException(PbipErrorCode code, Map<String, Object> context) {
        this(code, context, null);
    }

    public PbipException(PbipErrorCode code, String key, Object value) {
        this(code, Map.of(key, String.valueOf(value)), null);
    }

    public PbipException(PbipErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code.getMessage(), cause);
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
    }

    public PbipErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public List<Path> getFiles() {
        return Collections.unmodifiableList(files);
    }

    public List<String> getIdentifiers() {
        return Collections.unmodifiableList(identifiers);
    }

    public List<String> getSuggestions() {
        return Collections.unmodifiableList(suggestions);
    }

    public PbipException addFile(Path file) {
        if (file != null && !files.contains(file)) {
            files.add(file);
        }
        return this;
    }

    public PbipException addIdentifier(String identifier) {
        if (identifier != null && !identifiers.contains(identifier)) {
            identifiers.add(identifier);
        }
        return this;
    }

    public PbipException addSuggestion(String suggestion) {
        suggestions.add(suggestion);
        return this;
    }

    /**
     * Returns a formatted user-friendly error message.
     */
    public String toUserMessage() {
        StringBuilder sb = new StringBuilder(code.format(context));
        if (!files.isEmpty()) {
            sb.append("\nFiles: ");
            files.forEach(f -> sb.append("\n  - ").append(f));
        }
        if (!identifiers.isEmpty()) {
            sb.append("\nIdentifiers: ").append(String.join(", ", identifiers));
        }
        for (String suggestion : suggestions) {
            sb.append("\n  * ").append(suggestion);
        }
        return sb.toString();
    }

    @Override
    public String getMessage() {
        return toUserMessage();
    }

    /**
     * Returns a compact single-line error message for logs.
     */
    public String toLogMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(code.name()).append("] ").append(code.getMessage());
        if (!context.isEmpty()) {
            sb.append(" | ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }
        if (!files.isEmpty()) {
            sb.append(" | files=").append(files.size());
        }
        return sb.toString();
    }
}
