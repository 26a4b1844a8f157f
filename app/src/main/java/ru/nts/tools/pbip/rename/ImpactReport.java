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

import ru.nts.tools.pbip.graph.ResolutionIssue;
import ru.nts.tools.pbip.project.FileFamily;

import java.nio.file.Path;
import java.util.List;

/**
 * Результат сухого прогона: какие файлы и сколько мест будут изменены, что мешает применению.
 *
 * @param mappings         Переименования в отображаемой форме.
 * @param files            Затронутые файлы с количеством мест.
 * @param totalOccurrences Всего мест к перезаписи.
 * @param conflicts        Конфликты; непустой список блокирует применение.
 * @param warnings         Предупреждения, не блокирующие применение.
 * @param excluded         Проблемные места, исключенные из перезаписи при allowPartial.
 */
public record ImpactReport(List<String> mappings, List<FileImpact> files, int totalOccurrences,
                           List<Conflict> conflicts, List<String> warnings, List<ResolutionIssue> excluded) {

    /**
     * @param file        Файл.
     * @param family      Модель или отчет.
     * @param occurrences Количество мест в файле.
     */
    public record FileImpact(Path file, FileFamily family, int occurrences) {
    }

    public ImpactReport {
        mappings = List.copyOf(mappings);
        files = List.copyOf(files);
        conflicts = List.copyOf(conflicts);
        warnings = List.copyOf(warnings);
        excluded = List.copyOf(excluded);
    }

    public boolean blocked() {
        return !conflicts.isEmpty();
    }

    public int occurrencesIn(Path file) {
        return files.stream().filter(f -> f.file().equals(file)).mapToInt(FileImpact::occurrences).sum();
    }
}
