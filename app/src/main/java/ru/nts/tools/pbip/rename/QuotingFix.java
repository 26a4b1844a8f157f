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
import java.util.Map;
import java.util.Optional;

/**
 * Результат исправления кавычек вокруг имен таблиц в DAX.
 *
 * @param fixes   Количество исправлений по файлам.
 * @param applied Записаны ли изменения.
 * @param commit  Результат коммита, если изменения записаны.
 */
public record QuotingFix(Map<Path, Integer> fixes, boolean applied, Optional<CommitResult> commit) {

    public QuotingFix {
        fixes = Map.copyOf(fixes);
    }

    public int total() {
        return fixes.values().stream().mapToInt(Integer::intValue).sum();
    }
}
