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
package ru.nts.tools.pbip.project;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Расположение PBIP-проекта на диске.
 *
 * @param root              Папка проекта.
 * @param pbipFile          Файл .pbip, если он есть.
 * @param semanticModelDir  Папка *.SemanticModel.
 * @param reportDirs        Папки *.Report (может быть пусто).
 */
public record PbipProject(Path root, Optional<Path> pbipFile, Path semanticModelDir, List<Path> reportDirs) {

    public PbipProject {
        reportDirs = List.copyOf(reportDirs);
    }

    public String name() {
        String dir = semanticModelDir.getFileName().toString();
        return dir.substring(0, dir.length() - ProjectLoader.SEMANTIC_MODEL_SUFFIX.length());
    }
}
