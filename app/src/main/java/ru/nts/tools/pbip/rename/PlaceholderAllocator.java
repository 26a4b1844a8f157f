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

import java.util.HashSet;
import java.util.Set;

/**
 * Выдает временные имена вида {@code __pbip_tmp_1}, не совпадающие ни с одним занятым именем.
 */
public class PlaceholderAllocator {

    private final String prefix;
    private final Set<String> taken = new HashSet<>();
    private int counter;

    /**
     * @param prefix Префикс временных имен.
     * @param taken  Занятые имена (сравнение без учета регистра).
     */
    public PlaceholderAllocator(String prefix, Iterable<String> taken) {
        this.prefix = prefix;
        for (String name : taken) {
            this.taken.add(IdentifierKey.fold(name));
        }
    }

    public String next() {
        String candidate;
        do {
            candidate = prefix + (++counter);
        } while (!taken.add(IdentifierKey.fold(candidate)));
        return candidate;
    }

    public String getPrefix() {
        return prefix;
    }
}
