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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Malformed model or report file. Always fatal for the current operation.
 */
public class ModelParseException extends PbipException {

    private final Path file;
    private final int line;
    private final int column;

    public ModelParseException(Path file, int line, int column, String detail) {
        this(file, line, column, detail, null);
    }

    public ModelParseException(Path file, int line, int column, String detail, Throwable cause) {
        super(PbipErrorCode.PARSE_ERROR, createContext(file, line, column, detail), cause);
        this.file = file;
        this.line = line;
        this.column = column;
        addFile(file);
    }

    private static Map<String, Object> createContext(Path file, int line, int column, String detail) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("file", file != null ? file.toString() : "<memory>");
        ctx.put("line", line);
        ctx.put("column", column);
        ctx.put("detail", detail);
        return ctx;
    }

    public Path getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getDetail() {
        return String.valueOf(getContext().get("detail"));
    }
}
