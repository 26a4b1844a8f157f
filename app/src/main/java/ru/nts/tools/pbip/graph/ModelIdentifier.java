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

/**
 * Объявленный в модели идентификатор с именами в исходном регистре.
 *
 * @param key       Ключ без учета регистра.
 * @param tableName Имя таблицы-владельца как объявлено ({@code null} для таблиц).
 * @param name      Имя как объявлено.
 * @param file      Файл объявления.
 * @param span      Положение имени в объявлении.
 */
public record ModelIdentifier(IdentifierKey key, String tableName, String name, Path file, SourceSpan span) {

    public IdentifierKind kind() {
        return key.kind();
    }

    /**
     * Отображаемое квалифицированное имя: {@code 'Sales'} или {@code 'Sales'[Amount]}.
     */
    public String qualifiedName() {
        String quotedTable = "'" + (tableName != null ? tableName : name).replace("'", "''") + "'";
        return key.kind() == IdentifierKind.TABLE ? quotedTable : quotedTable + "[" + name.replace("]", "]]") + "]";
    }

    @Override
    public String toString() {
        return key.kind() + " " + qualifiedName();
    }
}
