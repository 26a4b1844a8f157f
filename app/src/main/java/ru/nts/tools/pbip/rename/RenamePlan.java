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

import ru.nts.tools.pbip.graph.IdentifierKey;
import ru.nts.tools.pbip.graph.ReferenceOccurrence;
import ru.nts.tools.pbip.graph.ResolutionIssue;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Неизменяемый план переименования.
 *
 * <p>Фазы применяются по порядку; ключи каждой фазы относятся к графу,
 * построенному из результата предыдущей фазы. Первая фаза (временные имена)
 * присутствует только если в пакете есть цепочки или циклы.
 *
 * @param request           Исходный запрос.
 * @param mappings          Сопоставленные переименования.
 * @param phases            Фазы подстановки.
 * @param occurrences       Места, которые будут перезаписаны (в исходном графе).
 * @param finalKeys         Ключ до переименования -> ключ после всего пакета.
 * @param placeholderPrefix Префикс временных имен.
 * @param report            Отчет о влиянии.
 */
public record RenamePlan(RenameRequest request, List<ResolvedMapping> mappings, List<SubstitutionPhase> phases,
                         List<ReferenceOccurrence> occurrences, Map<IdentifierKey, IdentifierKey> finalKeys,
                         String placeholderPrefix, ImpactReport report) {

    public RenamePlan {
        mappings = List.copyOf(mappings);
        phases = List.copyOf(phases);
        occurrences = List.copyOf(occurrences);
        finalKeys = Collections.unmodifiableMap(new LinkedHashMap<>(finalKeys));
    }

    public Set<Path> files() {
        Set<Path> files = new LinkedHashSet<>();
        occurrences.forEach(o -> files.add(o.file()));
        return files;
    }

    public List<ResolutionIssue> excluded() {
        return report.excluded();
    }

    public boolean isPartial() {
        return request.allowPartial() && !report.excluded().isEmpty();
    }

    public boolean usesPlaceholders() {
        return phases.size() > 1;
    }
}
