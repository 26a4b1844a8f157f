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
package ru.nts.tools.pbip.graph;

import ru.nts.tools.pbip.core.SourceSpan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Таблица символов модели: все объявленные таблицы, колонки и меры.
 * Поиск без учета регистра. После {@link Builder#build()} не изменяется.
 */
public final class ModelSymbolTable {

    private final Map<IdentifierKey, ModelIdentifier> byKey;
    private final Map<String, List<ModelIdentifier>> membersByTable;
    private final Map<String, List<ModelIdentifier>> measuresByName;
    private final Map<String, List<ModelIdentifier>> columnsByName;

    private ModelSymbolTable(Map<IdentifierKey, ModelIdentifier> byKey) {
        this.byKey = Collections.unmodifiableMap(byKey);
        Map<String, List<ModelIdentifier>> members = new LinkedHashMap<>();
        Map<String, List<ModelIdentifier>> measures = new LinkedHashMap<>();
        Map<String, List<ModelIdentifier>> columns = new LinkedHashMap<>();
        for (ModelIdentifier id : byKey.values()) {
            if (id.kind() == IdentifierKind.TABLE) {
                continue;
            }
            members.computeIfAbsent(id.key().table(), k -> new ArrayList<>()).add(id);
            Map<String, List<ModelIdentifier>> byName = id.kind() == IdentifierKind.MEASURE ? measures : columns;
            byName.computeIfAbsent(id.key().name(), k -> new ArrayList<>()).add(id);
        }
        this.membersByTable = members;
        this.measuresByName = measures;
        this.columnsByName = columns;
    }

    public Optional<ModelIdentifier> get(IdentifierKey key) {
        return Optional.ofNullable(byKey.get(key));
    }

    public boolean contains(IdentifierKey key) {
        return byKey.containsKey(key);
    }

    public Optional<ModelIdentifier> table(String name) {
        return get(IdentifierKey.table(name));
    }

    public Optional<ModelIdentifier> column(String table, String name) {
        return get(IdentifierKey.column(table, name));
    }

    public Optional<ModelIdentifier> measure(String table, String name) {
        return get(IdentifierKey.measure(table, name));
    }

    /**
     * Колонки и меры таблицы с заданным именем.
     */
    public List<ModelIdentifier> members(String table, String name) {
        List<ModelIdentifier> result = new ArrayList<>(2);
        column(table, name).ifPresent(result::add);
        measure(table, name).ifPresent(result::add);
        return result;
    }

    /**
     * Все колонки и меры таблицы.
     */
    public List<ModelIdentifier> members(String table) {
        return membersByTable.getOrDefault(IdentifierKey.fold(table), List.of());
    }

    public List<ModelIdentifier> measuresNamed(String name) {
        return measuresByName.getOrDefault(IdentifierKey.fold(name), List.of());
    }

    public List<ModelIdentifier> columnsNamed(String name) {
        return columnsByName.getOrDefault(IdentifierKey.fold(name), List.of());
    }

    public List<ModelIdentifier> tables() {
        return byKey.values().stream().filter(id -> id.kind() == IdentifierKind.TABLE).collect(Collectors.toList());
    }

    public Collection<ModelIdentifier> all() {
        return byKey.values();
    }

    public int size() {
        return byKey.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<IdentifierKey, ModelIdentifier> byKey = new LinkedHashMap<>();
        private final List<ModelIdentifier> duplicates = new ArrayList<>();

        private Builder() {
        }

        /**
         * Добавляет объявление. Повторное объявление того же ключа не заменяет первое
         * и возвращается в {@link #duplicates()}.
         */
        public Builder declare(IdentifierKind kind, String table, String name, Path file, SourceSpan span) {
            IdentifierKey key = IdentifierKey.of(kind, table, name);
            ModelIdentifier id = new ModelIdentifier(key, table, name, file, span);
            if (byKey.putIfAbsent(key, id) != null) {
                duplicates.add(id);
            }
            return this;
        }

        public List<ModelIdentifier> duplicates() {
            return Collections.unmodifiableList(duplicates);
        }

        public ModelSymbolTable build() {
            return new ModelSymbolTable(new LinkedHashMap<>(byKey));
        }
    }
}
