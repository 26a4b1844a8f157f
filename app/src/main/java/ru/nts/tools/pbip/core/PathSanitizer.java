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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Проверки путей и размеров файлов проекта.
 * Гарантирует, что движок читает и пишет только внутри корня проекта,
 * и не загружает в память гигантские файлы.
 */
public class PathSanitizer {

    private PathSanitizer() {
    }

    /**
     * Нормализует путь и проверяет, что он находится внутри корня.
     *
     * @throws SecurityException если путь ведет за пределы корня (включая symlink).
     */
    public static Path requireInside(Path root, Path path) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path target = path.toAbsolutePath().normalize();
        if (!target.startsWith(normalizedRoot)) {
            throw new SecurityException("Access denied: path is outside of project root: " + path + " (Root: " + normalizedRoot + ")");
        }
        try {
            if (Files.exists(target) && !target.toRealPath().startsWith(normalizedRoot.toRealPath())) {
                throw new SecurityException("Access denied: symbolic link leads outside of project root: " + path);
            }
        } catch (IOException e) {
            throw new SecurityException("Cannot resolve real path of " + path + ": " + e.getMessage(), e);
        }
        return target;
    }

    /**
     * Проверяет файл на соответствие лимиту размера.
     *
     * @throws PbipException с кодом FILE_TOO_LARGE, если файл больше лимита.
     */
    public static void checkFileSize(Path path, long maxBytes) throws IOException, PbipException {
        long size = Files.size(path);
        if (size > maxBytes) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("file", path.toString());
            ctx.put("size", size);
            ctx.put("maxAllowed", maxBytes);
            throw new PbipException(PbipErrorCode.FILE_TOO_LARGE, ctx).addFile(path);
        }
    }
}
