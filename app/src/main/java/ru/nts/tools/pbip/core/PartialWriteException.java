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
 * I/O failure in the middle of a commit. Thrown only after every touched file
 * was restored from its snapshot.
 */
public class PartialWriteException extends PbipException {

    public PartialWriteException(Path failedFile, int restoredFiles, Throwable cause) {
        super(PbipErrorCode.PARTIAL_WRITE, createContext(failedFile, restoredFiles), cause);
        addFile(failedFile);
    }

    private static Map<String, Object> createContext(Path failedFile, int restoredFiles) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("file", failedFile.toString());
        ctx.put("restored", restoredFiles);
        return ctx;
    }
}
