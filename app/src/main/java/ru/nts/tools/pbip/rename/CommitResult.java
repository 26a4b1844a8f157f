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
package ru.nts.tools.pbip.rename;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Результат успешного коммита.
 *
 * @param committedFiles Записанные файлы.
 * @param mappings       Примененные переименования в отображаемой форме.
 * @param occurrences    Количество перезаписанных мест.
 * @param backup         Каталог резервной копии, если она создавалась.
 * @param report         Отчет о влиянии (для переименований; {@code null} для прочих правок).
 */
public record CommitResult(List<Path> committedFiles, List<String> mappings, int occurrences,
                           Optional<Path> backup, ImpactReport report) {

    public CommitResult {
        committedFiles = List.copyOf(committedFiles);
        mappings = List.copyOf(mappings);
    }
}
