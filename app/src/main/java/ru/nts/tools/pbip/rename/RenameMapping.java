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

import ru.nts.tools.pbip.graph.IdentifierKind;

/**
 * Запрошенное переименование одного идентификатора.
 *
 * <p>{@code oldQualifiedName} принимает формы {@code Sales}, {@code 'Sales'},
 * {@code Sales[Amount]}, {@code 'Fact Sales'[Amount]}, {@code Sales.Amount},
 * {@code [Total]} и просто {@code Total} (имя меры ищется по всей модели).
 *
 * @param kind             Вид идентификатора.
 * @param oldQualifiedName Текущее имя.
 * @param newName          Новое имя без таблицы.
 */
public record RenameMapping(IdentifierKind kind, String oldQualifiedName, String newName) {

    public RenameMapping {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (oldQualifiedName == null || oldQualifiedName.isBlank()) {
            throw new IllegalArgumentException("old name is required");
        }
        if (newName == null) {
            throw new IllegalArgumentException("new name is required");
        }
    }

    public static RenameMapping table(String oldName, String newName) {
        return new RenameMapping(IdentifierKind.TABLE, oldName, newName);
    }

    public static RenameMapping column(String oldQualifiedName, String newName) {
        return new RenameMapping(IdentifierKind.COLUMN, oldQualifiedName, newName);
    }

    public static RenameMapping measure(String oldQualifiedName, String newName) {
        return new RenameMapping(IdentifierKind.MEASURE, oldQualifiedName, newName);
    }

    @Override
    public String toString() {
        return kind + " " + oldQualifiedName + " -> " + newName;
    }
}
