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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Одна фаза подстановки: ключи идентификаторов в графе, построенном перед фазой, и их новые имена.
 *
 * @param name    Название фазы для журнала.
 * @param renames Ключ -> новое имя.
 */
public record SubstitutionPhase(String name, Map<IdentifierKey, String> renames) {

    public SubstitutionPhase {
        renames = Collections.unmodifiableMap(new LinkedHashMap<>(renames));
    }

    public boolean isEmpty() {
        return renames.isEmpty();
    }
}
