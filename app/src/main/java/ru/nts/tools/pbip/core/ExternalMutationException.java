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
 * On-disk content no longer matches the snapshot taken by the transaction.
 */
public class ExternalMutationException extends PbipException {

    public ExternalMutationException(Path file, long expectedCrc, long actualCrc) {
        super(PbipErrorCode.EXTERNAL_MUTATION, createContext(file, expectedCrc, actualCrc));
        addFile(file);
    }

    private static Map<String, Object> createContext(Path file, long expectedCrc, long actualCrc) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("file", file.toString());
        ctx.put("expectedCrc", String.format("%08X", expectedCrc));
        ctx.put("actualCrc", actualCrc < 0 ? "missing" : String.format("%08X", actualCrc));
        return ctx;
    }
}
